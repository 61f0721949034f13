/**
 * SignalingIntegrationTest.java
 *
 * 在真实的内嵌服务器上运行信令服务端，用真实的观众端客户端连接它。
 * ffmpeg 中转进程被模拟，其余组件都是真实的。
 */
package club.ppmc.theater;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.theater.config.TheaterProperties;
import club.ppmc.theater.model.ClientState;
import club.ppmc.theater.model.Member;
import club.ppmc.theater.model.event.AuthenticatedEvent;
import club.ppmc.theater.model.event.ChatMessageEvent;
import club.ppmc.theater.model.event.MembersChangedEvent;
import club.ppmc.theater.model.event.SessionErrorEvent;
import club.ppmc.theater.protocol.SignalCodec;
import club.ppmc.theater.service.FfmpegService;
import club.ppmc.theater.service.SessionClient;
import club.ppmc.theater.service.SessionCoordinator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.socket.client.WebSocketClient;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
            "theater.network.advertised-address=127.0.0.1",
            "theater.network.srt-base-port=42000",
            "theater.network.reconnect-interval=100ms",
            "theater.network.max-reconnect-attempts=1"
        })
@ActiveProfiles("test")
class SignalingIntegrationTest {

    private static final String CODE = "114514";

    @LocalServerPort
    private int port;

    @Autowired
    private SessionCoordinator coordinator;

    @Autowired
    private SignalCodec codec;

    @Autowired
    private WebSocketClient webSocketClient;

    @Autowired
    private TheaterProperties properties;

    @MockBean
    private FfmpegService ffmpegService;

    private final List<Object> firstEvents = new CopyOnWriteArrayList<>();
    private final List<Object> secondEvents = new CopyOnWriteArrayList<>();
    private SessionClient first;
    private SessionClient second;

    @BeforeEach
    void setUp() {
        coordinator.open("Host", CODE, "0.0.0.0");
        first = new SessionClient(webSocketClient, codec, firstEvents::add, properties.getNetwork());
        second = new SessionClient(webSocketClient, codec, secondEvents::add, properties.getNetwork());
    }

    @AfterEach
    void tearDown() {
        first.shutdown();
        second.shutdown();
        coordinator.close();
    }

    @Test
    void viewersJoinChatAndLeave() {
        first.connect("127.0.0.1", port, "Saber", CODE);
        awaitTrue(first::isAuthenticated);
        second.connect("127.0.0.1", port, "Saber", CODE);
        awaitTrue(second::isAuthenticated);

        assertThat(first.getNickname()).isEqualTo("Saber");
        assertThat(second.getNickname()).isEqualTo("Saber_2");
        assertThat(first.getSrtPort()).isNotEqualTo(second.getSrtPort());
        assertThat(first.getServerIp()).isEqualTo("127.0.0.1");

        AuthenticatedEvent auth = (AuthenticatedEvent) firstEvents.stream()
                .filter(e -> e instanceof AuthenticatedEvent).findFirst().orElseThrow();
        assertThat(auth.srtPort()).isBetween(42000, 42100);

        awaitTrue(() -> lastRoster(firstEvents).size() == 3);
        assertThat(coordinator.getMembers()).extracting(Member::nickname).containsExactly("Host", "Saber", "Saber_2");

        second.sendChat("大家好");
        awaitTrue(() -> chats(firstEvents).size() == 1 && chats(secondEvents).size() == 1);
        assertThat(chats(firstEvents).get(0).nickname()).isEqualTo("Saber_2");
        assertThat(chats(firstEvents).get(0).message()).isEqualTo("大家好");

        second.disconnect();
        awaitTrue(() -> coordinator.getMembers().size() == 2);
        awaitTrue(() -> lastRoster(firstEvents).size() == 2);
        assertThat(firstEvents).anyMatch(e -> e instanceof ChatMessageEvent chat
                && chat.system() && chat.message().contains("Saber_2 离开了放映室"));
    }

    @Test
    void wrongCodeIsRejected() {
        first.connect("127.0.0.1", port, "Saber", "000000");

        awaitTrue(() -> firstEvents.stream().anyMatch(e -> e instanceof SessionErrorEvent));
        SessionErrorEvent error = (SessionErrorEvent) firstEvents.stream()
                .filter(e -> e instanceof SessionErrorEvent).findFirst().orElseThrow();
        assertThat(error.terminal()).isTrue();
        awaitTrue(() -> first.getState() == ClientState.DISCONNECTED);
        assertThat(coordinator.getMembers()).hasSize(1);
    }

    private static List<ChatMessageEvent> chats(List<Object> events) {
        return events.stream()
                .filter(e -> e instanceof ChatMessageEvent chat && !chat.system())
                .map(ChatMessageEvent.class::cast)
                .toList();
    }

    private static List<Member> lastRoster(List<Object> events) {
        List<Member> roster = List.of();
        for (Object event : events) {
            if (event instanceof MembersChangedEvent changed) {
                roster = changed.members();
            }
        }
        return roster;
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("条件在 10 秒内未满足");
            }
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
    }
}

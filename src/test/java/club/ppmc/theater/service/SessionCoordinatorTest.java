/**
 * SessionCoordinatorTest.java
 *
 * 信令服务端的测试。WebSocket 连接用 Mockito 模拟，发送在调用线程上同步执行，
 * 每个连接收到的消息都经过编解码器还原后再断言。
 */
package club.ppmc.theater.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.theater.config.TheaterProperties;
import club.ppmc.theater.exception.ProcessLaunchException;
import club.ppmc.theater.model.Member;
import club.ppmc.theater.model.Role;
import club.ppmc.theater.model.event.ChatMessageEvent;
import club.ppmc.theater.model.event.MembersChangedEvent;
import club.ppmc.theater.protocol.SignalCodec;
import club.ppmc.theater.protocol.SignalMessage;
import club.ppmc.theater.util.PortAllocator;
import com.google.gson.Gson;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class SessionCoordinatorTest {

    private static final String CODE = "114514";

    private final SignalCodec codec = new SignalCodec(new Gson());
    private final FfmpegService ffmpegService = mock(FfmpegService.class);
    private final PortAllocator portAllocator = mock(PortAllocator.class);
    private final TheaterProperties properties = new TheaterProperties();
    private final List<Object> events = new CopyOnWriteArrayList<>();

    private SessionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        properties.getNetwork().setAdvertisedAddress("203.0.113.7");
        when(portAllocator.isPortAvailable(anyInt())).thenReturn(true);
        coordinator = new SessionCoordinator(codec, ffmpegService, portAllocator, properties, events::add, Runnable::run);
    }

    @Test
    void rejectsConnectionsWhileClosed() throws IOException {
        FakeClient client = new FakeClient("c1");

        coordinator.afterConnectionEstablished(client.session);

        assertThat(client.received()).containsExactly(new SignalMessage.ServerError(SessionCoordinator.NOT_OPEN));
        verify(client.session).close(CloseStatus.SERVICE_RESTARTED);
    }

    @Test
    void openPublishesHostOnlyRoster() {
        coordinator.open("Host", CODE, "0.0.0.0");

        assertThat(coordinator.isOpen()).isTrue();
        assertThat(coordinator.getAdvertisedAddress()).isEqualTo("203.0.113.7");
        assertThat(events).containsExactly(new MembersChangedEvent(List.of(new Member("Host", Role.SENDER))));
        assertThatThrownBy(() -> coordinator.open("Host", CODE, "0.0.0.0")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void authenticatesViewerAndStartsRelay() {
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient saber = connect("c1");

        saber.send(new SignalMessage.Auth(CODE, "Saber"));

        assertThat(saber.received()).containsExactly(
                new SignalMessage.AuthSuccess("Saber", 10000, "203.0.113.7"),
                new SignalMessage.Members(List.of(new Member("Host", Role.SENDER), new Member("Saber", Role.RECEIVER))));
        verify(ffmpegService).startViewerRelay("client_Saber_10000", 10000, "0.0.0.0");
        assertThat(events).last().isEqualTo(new MembersChangedEvent(
                List.of(new Member("Host", Role.SENDER), new Member("Saber", Role.RECEIVER))));
    }

    @Test
    void duplicateNicknamesGetSuffixAndDistinctPorts() {
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient first = connect("c1");
        FakeClient second = connect("c2");
        FakeClient third = connect("c3");

        first.send(new SignalMessage.Auth(CODE, "Saber"));
        second.send(new SignalMessage.Auth(CODE, "Saber"));
        third.send(new SignalMessage.Auth(CODE, "Host"));

        assertThat(second.received().get(0)).isEqualTo(new SignalMessage.AuthSuccess("Saber_2", 10001, "203.0.113.7"));
        assertThat(third.received().get(0)).isEqualTo(new SignalMessage.AuthSuccess("Host_2", 10002, "203.0.113.7"));
        assertThat(coordinator.getMembers()).extracting(Member::nickname)
                .containsExactly("Host", "Saber", "Saber_2", "Host_2");
        assertThat(first.received()).contains(new SignalMessage.Join("Saber_2", "Saber_2 加入了放映室"));
        assertThat(second.received()).doesNotContain(new SignalMessage.Join("Saber_2", "Saber_2 加入了放映室"));
    }

    @Test
    void blankNicknameGetsRandomRoleName() {
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient client = connect("c1");

        client.send(new SignalMessage.Auth(CODE, "  "));

        var success = (SignalMessage.AuthSuccess) client.received().get(0);
        assertThat(success.nickname()).isIn(
                "Archer", "Saber", "Caster", "Assassin", "Rider", "Lancer", "Berserker", "Ruler", "Avenger");
    }

    @Test
    void skipsPortsThatAreInUse() {
        when(portAllocator.isPortAvailable(10000)).thenReturn(false);
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient client = connect("c1");

        client.send(new SignalMessage.Auth(CODE, "Saber"));

        assertThat(client.received().get(0)).isEqualTo(new SignalMessage.AuthSuccess("Saber", 10001, "203.0.113.7"));
    }

    @Test
    void wrongCodeFailsAndCloses() throws IOException {
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient client = connect("c1");

        client.send(new SignalMessage.Auth("000000", "Saber"));

        assertThat(client.received()).containsExactly(new SignalMessage.AuthFailed(SessionCoordinator.WRONG_CODE));
        verify(client.session).close(CloseStatus.NORMAL);
        verify(ffmpegService, never()).startViewerRelay(anyString(), anyInt(), anyString());
        assertThat(coordinator.getMembers()).hasSize(1);
    }

    @Test
    void exhaustedPortsRejectViewer() throws IOException {
        when(portAllocator.isPortAvailable(anyInt())).thenReturn(false);
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient client = connect("c1");

        client.send(new SignalMessage.Auth(CODE, "Saber"));

        assertThat(client.received()).containsExactly(new SignalMessage.ServerError(SessionCoordinator.NO_PORT));
        verify(client.session).close(CloseStatus.SERVER_ERROR);
    }

    @Test
    void relayFailureCommitsNothing() throws IOException {
        doThrow(new ProcessLaunchException("client_Saber_10000", List.of("ffmpeg"), new IOException("boom")))
                .when(ffmpegService).startViewerRelay(eq("client_Saber_10000"), anyInt(), anyString());
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient failed = connect("c1");

        failed.send(new SignalMessage.Auth(CODE, "Saber"));

        assertThat(failed.received()).containsExactly(new SignalMessage.ServerError(SessionCoordinator.RELAY_FAILED));
        verify(failed.session).close(CloseStatus.SERVER_ERROR);

        FakeClient retry = connect("c2");
        retry.send(new SignalMessage.Auth(CODE, "Saber"));

        // 失败的尝试没有占用昵称；端口游标也没有前进，10000 会被再次尝试
        verify(ffmpegService, times(2))
                .startViewerRelay(eq("client_Saber_10000"), eq(10000), anyString());
    }

    @Test
    void unauthenticatedMessagesAreRefused() {
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient client = connect("c1");

        client.send(SignalMessage.Chat.outgoing("hello"));
        client.sendRaw("{not json");

        assertThat(client.received()).containsExactly(
                new SignalMessage.ServerError(SessionCoordinator.NOT_AUTHENTICATED),
                new SignalMessage.ServerError("消息格式错误"));
        assertThat(events).noneMatch(e -> e instanceof ChatMessageEvent);
    }

    @Test
    void chatIsDeliveredExactlyOnceToEveryViewer() {
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient saber = authenticated("c1", "Saber");
        FakeClient archer = authenticated("c2", "Archer");
        FakeClient pending = connect("c3");
        saber.clear();
        archer.clear();

        saber.send(SignalMessage.Chat.outgoing("开始了吗"));

        assertThat(saber.received()).hasSize(1);
        assertThat(archer.received()).hasSize(1);
        var chat = (SignalMessage.Chat) archer.received().get(0);
        assertThat(chat.nickname()).isEqualTo("Saber");
        assertThat(chat.message()).isEqualTo("开始了吗");
        assertThat(chat.timestamp()).isNotBlank();
        assertThat(pending.received()).isEmpty();
        assertThat(events).filteredOn(e -> e instanceof ChatMessageEvent).hasSize(1);
    }

    @Test
    void hostChatUsesHostNickname() {
        assertThat(coordinator.sendHostChat("早")).isFalse();

        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient saber = authenticated("c1", "Saber");
        saber.clear();

        assertThat(coordinator.sendHostChat("马上开始")).isTrue();
        assertThat(((SignalMessage.Chat) saber.received().get(0)).nickname()).isEqualTo("Host");
    }

    @Test
    void heartbeatIsEchoed() {
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient saber = authenticated("c1", "Saber");
        saber.clear();

        saber.send(new SignalMessage.Heartbeat());

        assertThat(saber.received()).containsExactly(new SignalMessage.Heartbeat());
    }

    @Test
    void disconnectStopsRelayAndUpdatesRoster() {
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient saber = authenticated("c1", "Saber");
        FakeClient archer = authenticated("c2", "Archer");
        archer.clear();

        coordinator.afterConnectionClosed(saber.session, CloseStatus.NORMAL);

        verify(ffmpegService).stop("client_Saber_10000");
        assertThat(archer.received()).containsExactly(
                new SignalMessage.Leave("Saber", "Saber 离开了放映室"),
                new SignalMessage.Members(List.of(new Member("Host", Role.SENDER), new Member("Archer", Role.RECEIVER))));
        assertThat(events).last().isEqualTo(new MembersChangedEvent(
                List.of(new Member("Host", Role.SENDER), new Member("Archer", Role.RECEIVER))));

        // 昵称被释放，可以重新使用
        FakeClient again = authenticated("c3", "Saber");
        assertThat(again.received().get(0)).isInstanceOf(SignalMessage.AuthSuccess.class);
        assertThat(((SignalMessage.AuthSuccess) again.received().get(0)).nickname()).isEqualTo("Saber");
    }

    @Test
    void closeDisconnectsEveryone() throws IOException {
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient saber = authenticated("c1", "Saber");

        coordinator.close();
        coordinator.close();

        assertThat(coordinator.isOpen()).isFalse();
        assertThat(coordinator.getMembers()).isEmpty();
        verify(ffmpegService).stop("client_Saber_10000");
        verify(saber.session).close(CloseStatus.GOING_AWAY);
    }

    @Test
    void concurrentJoinsGetDistinctPorts() throws Exception {
        coordinator.open("Host", CODE, "0.0.0.0");
        int viewers = 16;
        List<FakeClient> clients = new ArrayList<>();
        for (int i = 0; i < viewers; i++) {
            clients.add(connect("c" + i));
        }

        ExecutorService pool = Executors.newFixedThreadPool(viewers);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> joins = new ArrayList<>();
            for (FakeClient client : clients) {
                joins.add(pool.submit(() -> {
                    start.await();
                    client.send(new SignalMessage.Auth(CODE, "Saber"));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> join : joins) {
                join.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<Integer> ports = clients.stream()
                .map(c -> (SignalMessage.AuthSuccess) c.received().get(0))
                .map(SignalMessage.AuthSuccess::srtPort)
                .toList();
        assertThat(ports).doesNotHaveDuplicates().hasSize(viewers);
        assertThat(coordinator.getMembers()).extracting(Member::nickname).doesNotHaveDuplicates().hasSize(viewers + 1);
    }

    @Test
    void failedSendDoesNotAffectOtherViewersOrLaterMessages() {
        coordinator.open("Host", CODE, "0.0.0.0");
        FakeClient saber = authenticated("c1", "Saber");
        FakeClient archer = authenticated("c2", "Archer");
        FakeClient caster = authenticated("c3", "Caster");
        saber.clear();
        archer.clear();
        caster.clear();
        archer.failNextSends(1);

        saber.send(SignalMessage.Chat.outgoing("第一条"));
        saber.send(SignalMessage.Chat.outgoing("第二条"));

        assertThat(caster.received()).extracting(m -> ((SignalMessage.Chat) m).message())
                .containsExactly("第一条", "第二条");
        assertThat(saber.received()).hasSize(2);
        // 失败的那一条丢失，但发送链没有中断
        assertThat(archer.received()).extracting(m -> ((SignalMessage.Chat) m).message())
                .containsExactly("第二条");
    }

    @Test
    void disconnectRacingAuthNeverLeaksRelay() throws Exception {
        Set<String> liveRelays = ConcurrentHashMap.newKeySet();
        doAnswer(invocation -> {
            liveRelays.add(invocation.getArgument(0));
            return null;
        }).when(ffmpegService).startViewerRelay(anyString(), anyInt(), anyString());
        doAnswer(invocation -> {
            return liveRelays.remove(invocation.<String>getArgument(0));
        }).when(ffmpegService).stop(anyString());
        coordinator.open("Host", CODE, "0.0.0.0");

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 300; i++) {
                FakeClient client = connect("v" + i);
                CountDownLatch start = new CountDownLatch(1);
                Future<?> auth = pool.submit(() -> {
                    start.await();
                    client.send(new SignalMessage.Auth(CODE, "Viewer"));
                    return null;
                });
                Future<?> closed = pool.submit(() -> {
                    start.await();
                    coordinator.afterConnectionClosed(client.session, CloseStatus.NORMAL);
                    return null;
                });
                start.countDown();
                auth.get(10, TimeUnit.SECONDS);
                closed.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(liveRelays).isEmpty();
        assertThat(coordinator.getMembers()).containsExactly(new Member("Host", Role.SENDER));
    }

    private FakeClient connect(String id) {
        FakeClient client = new FakeClient(id);
        coordinator.afterConnectionEstablished(client.session);
        return client;
    }

    private FakeClient authenticated(String id, String nickname) {
        FakeClient client = connect(id);
        client.send(new SignalMessage.Auth(CODE, nickname));
        return client;
    }

    /** 一个模拟的 WebSocket 连接，记录服务端发给它的所有消息。 */
    private final class FakeClient {

        final WebSocketSession session = mock(WebSocketSession.class);
        private final List<String> outbound = new CopyOnWriteArrayList<>();
        private final AtomicInteger failures = new AtomicInteger();

        FakeClient(String id) {
            when(session.getId()).thenReturn(id);
            when(session.isOpen()).thenReturn(true);
            when(session.getRemoteAddress()).thenReturn(new InetSocketAddress("127.0.0.1", 50000));
            try {
                doAnswer(invocation -> {
                    if (failures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                        throw new IOException("Broken pipe");
                    }
                    outbound.add(invocation.<TextMessage>getArgument(0).getPayload());
                    return null;
                }).when(session).sendMessage(any());
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }

        void send(SignalMessage message) {
            sendRaw(codec.encode(message));
        }

        void sendRaw(String text) {
            coordinator.handleTextMessage(session, new TextMessage(text));
        }

        List<SignalMessage> received() {
            return outbound.stream().map(codec::decode).toList();
        }

        void clear() {
            outbound.clear();
        }

        /** 让接下来的若干次发送抛出 IOException。 */
        void failNextSends(int count) {
            failures.set(count);
        }
    }
}

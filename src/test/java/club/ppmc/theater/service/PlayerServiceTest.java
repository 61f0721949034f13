/**
 * PlayerServiceTest.java
 */
package club.ppmc.theater.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.theater.config.TheaterProperties;
import club.ppmc.theater.model.Role;
import club.ppmc.theater.model.event.PlayerClosedEvent;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class PlayerServiceTest {

    private final ProcessSupervisor supervisor = new ProcessSupervisor(Duration.ofMillis(200), Duration.ofSeconds(2));
    private final TheaterProperties properties = new TheaterProperties();
    private final List<Object> events = new CopyOnWriteArrayList<>();
    private PlayerService service;

    @BeforeEach
    void setUp() {
        properties.getPlayer().setPollInterval(Duration.ofMillis(50));
        properties.getPlayer().setSenderRetryInterval(Duration.ofMillis(50));
        service = new PlayerService(supervisor, properties, events::add);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
        supervisor.shutdown();
    }

    @Test
    void receiverConnectsAsSrtCaller() {
        assertThat(service.receiverUrl("2001:db8::1", 10001))
                .isEqualTo("srt://[2001:db8::1]:10001?mode=caller&latency=3000");

        List<String> command = service.buildCommand(Role.RECEIVER, "srt://1.2.3.4:10001?mode=caller&latency=3000");
        assertThat(command.get(0)).isEqualTo("mpv");
        assertThat(command).contains("--keep-open=no", "--volume=100");
        assertThat(command).last().isEqualTo("srt://1.2.3.4:10001?mode=caller&latency=3000");
    }

    @Test
    void senderPreviewUsesSenderArguments() {
        List<String> command = service.buildCommand(Role.SENDER, "rtmp://127.0.0.1:1935/live/stream");

        assertThat(command).contains("--keep-open=yes", "--stream-lavf-o=rtmp_live=1");
        assertThat(command).doesNotContain("--keep-open=no");
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void publishesEventWhenPlayerExits() {
        // 把播放器换成 true，启动后立即退出，相当于用户关闭了窗口
        properties.getPrograms().setMpv("true");

        service.playReceiver("127.0.0.1", 10001);

        awaitTrue(() -> events.contains(new PlayerClosedEvent(Role.RECEIVER)));
        assertThat(service.isPlaying(Role.RECEIVER)).isFalse();
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void senderPreviewRetriesUntilStopped() {
        properties.getPrograms().setMpv("/nonexistent/mpv");

        service.playSenderPreview();
        sleep(200);
        service.stop(Role.SENDER);

        assertThat(service.isPlaying(Role.SENDER)).isFalse();
        assertThat(supervisor.getProcessNames()).isEmpty();
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void stopTerminatesRunningPlayerWithoutClosedEvent(@TempDir Path tempDir) throws IOException {
        Path player = tempDir.resolve("mpv");
        Files.writeString(player, "#!/bin/sh\nexec sleep 30\n");
        assertThat(player.toFile().setExecutable(true)).isTrue();
        properties.getPrograms().setMpv(player.toString());

        service.playReceiver("127.0.0.1", 10001);
        assertThat(service.isPlaying(Role.RECEIVER)).isTrue();

        service.stop(Role.RECEIVER);
        sleep(200);

        assertThat(service.isPlaying(Role.RECEIVER)).isFalse();
        assertThat(events).isEmpty();
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void stopRacingSenderPreviewLeavesNoPlayer(@TempDir Path tempDir) throws IOException {
        Path player = tempDir.resolve("mpv");
        Files.writeString(player, "#!/bin/sh\nexec sleep 30\n");
        assertThat(player.toFile().setExecutable(true)).isTrue();
        properties.getPrograms().setMpv(player.toString());

        for (int i = 0; i < 20; i++) {
            service.playSenderPreview();
            service.stop(Role.SENDER);
            sleep(100);

            assertThat(service.isPlaying(Role.SENDER)).isFalse();
        }
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("条件在 5 秒内未满足");
            }
            sleep(20);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}

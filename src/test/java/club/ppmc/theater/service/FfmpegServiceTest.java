/**
 * FfmpegServiceTest.java
 */
package club.ppmc.theater.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import club.ppmc.theater.config.TheaterProperties;
import club.ppmc.theater.exception.ProcessNotFoundException;
import club.ppmc.theater.model.StreamStats;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FfmpegServiceTest {

    private final ProcessSupervisor supervisor = mock(ProcessSupervisor.class);
    private final TheaterProperties properties = new TheaterProperties();
    private final FfmpegService service = new FfmpegService(supervisor, properties);

    @Test
    void ingestCommandListensOnSrtAndPublishesToLocalRtmp() {
        List<String> command = service.buildIngestCommand(9001, "0.0.0.0");

        assertThat(command.get(0)).isEqualTo("ffmpeg");
        assertThat(command).containsSubsequence("-hide_banner", "-loglevel", "warning", "-stats", "-nostdin");
        assertThat(command).containsSubsequence("-i", "srt://0.0.0.0:9001?mode=listener&latency=120");
        assertThat(command).containsSubsequence("-c", "copy", "-f", "flv");
        assertThat(command).endsWith("rtmp://127.0.0.1:1935/live/stream");
    }

    @Test
    void relayCommandReadsRtmpAndListensForViewer() {
        List<String> command = service.buildRelayCommand(10001, "::");

        assertThat(command).containsSubsequence("-re", "-i", "rtmp://127.0.0.1:1935/live/stream");
        assertThat(command).containsSubsequence("-f", "mpegts");
        assertThat(command).endsWith("srt://[::]:10001?mode=listener&latency=3000");
    }

    @Test
    void usesConfiguredExecutable() {
        properties.getPrograms().setFfmpeg("/opt/ffmpeg/bin/ffmpeg");

        assertThat(service.buildRelayCommand(10001, "0.0.0.0").get(0)).isEqualTo("/opt/ffmpeg/bin/ffmpeg");
    }

    @Test
    void ingestRestartsOnExitButViewerRelayDoesNot() {
        service.startIngest(9001, "0.0.0.0");
        service.startViewerRelay("client_Saber_10000", 10000, "0.0.0.0");

        verify(supervisor).start(eq(FfmpegService.INGEST_PROCESS), any(), any(), any(), any(), eq(true));
        verify(supervisor).start(eq("client_Saber_10000"), any(), any(), any(), any(), eq(false));
    }

    @Test
    void stoppingMissingProcessReportsFalse() {
        doThrow(new ProcessNotFoundException("client_x_1")).when(supervisor).stop("client_x_1");

        assertThat(service.stop("client_x_1")).isFalse();
        assertThat(service.stop("client_y_2")).isTrue();
    }

    @Test
    void parsesProgressLine() {
        Optional<StreamStats> stats = FfmpegService.parseStats(
                "frame=  120 fps= 30 q=-1.0 size=    1024kB time=00:00:04.00 bitrate=2097.2kbits/s speed=1x");

        assertThat(stats).contains(new StreamStats(30.0, "2097.2kbits/s", "00:00:04.00"));
    }

    @Test
    void ignoresNonProgressLines() {
        assertThat(FfmpegService.parseStats("Input #0, flv, from 'rtmp://127.0.0.1:1935/live/stream':")).isEmpty();
    }

    @Test
    void toleratesUnparseableFps() {
        Optional<StreamStats> stats = FfmpegService.parseStats("frame=0 fps=N/A time=N/A bitrate=N/A");

        assertThat(stats).isPresent();
        assertThat(stats.get().fps()).isNull();
        assertThat(stats.get().bitrate()).isEqualTo("N/A");
    }
}

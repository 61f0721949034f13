/**
 * FfmpegService.java
 *
 * 负责构建并启动 ffmpeg 中转进程：
 * 发送端的 SRT 输入转本地 RTMP（断开后自动重启），以及为每位观众把本地 RTMP 转发为独立的 SRT 监听端点。
 * 每个进程的输出写入名为 "ffmpeg.<进程名>" 的专用日志器，控制台只保留重要错误。
 */
package club.ppmc.theater.service;

import club.ppmc.theater.config.TheaterProperties;
import club.ppmc.theater.exception.ProcessNotFoundException;
import club.ppmc.theater.model.StreamStats;
import club.ppmc.theater.util.NetworkUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class FfmpegService {

    public static final String INGEST_PROCESS = "sender_srt_input";
    private static final String LOGGER_PREFIX = "ffmpeg.";

    private final ProcessSupervisor supervisor;
    private final TheaterProperties properties;

    public FfmpegService(ProcessSupervisor supervisor, TheaterProperties properties) {
        this.supervisor = supervisor;
        this.properties = properties;
    }

    /**
     * 启动发送端的 SRT -> RTMP 转换进程。推流端断开时 ffmpeg 会退出，由监管器自动重启继续等待。
     *
     * @param srtPort     SRT 监听端口。
     * @param bindAddress SRT 绑定地址。
     */
    public void startIngest(int srtPort, String bindAddress) {
        supervisor.start(
                INGEST_PROCESS,
                buildIngestCommand(srtPort, bindAddress),
                null,
                stdoutHandler(INGEST_PROCESS),
                stderrHandler(INGEST_PROCESS),
                true);
        log.info("SRT->RTMP转换进程已启动 (端口: {})", srtPort);
    }

    /**
     * 为一位观众启动 RTMP -> SRT 转发进程。该进程不会自动重启。
     *
     * @param processName 进程名称，约定为 client_&lt;昵称&gt;_&lt;端口&gt;。
     * @param srtPort     分配给该观众的 SRT 端口。
     * @param bindAddress SRT 绑定地址。
     */
    public void startViewerRelay(String processName, int srtPort, String bindAddress) {
        supervisor.start(
                processName,
                buildRelayCommand(srtPort, bindAddress),
                null,
                stdoutHandler(processName),
                stderrHandler(processName),
                false);
        log.info("RTMP->SRT转换进程已启动 (端口: {})", srtPort);
    }

    /**
     * 停止一个 ffmpeg 进程。
     *
     * @return 进程已不存在时为 false。
     */
    public boolean stop(String processName) {
        try {
            supervisor.stop(processName);
            log.debug("FFmpeg进程已停止: {}", processName);
            return true;
        } catch (ProcessNotFoundException e) {
            log.debug("FFmpeg进程 {} 不存在，可能已自行退出", processName);
            return false;
        }
    }

    public boolean stopIngest() {
        return stop(INGEST_PROCESS);
    }

    public boolean isRunning(String processName) {
        return supervisor.isRunning(processName);
    }

    List<String> buildIngestCommand(int srtPort, String bindAddress) {
        var ffmpeg = properties.getFfmpeg();
        List<String> command = new ArrayList<>();
        command.add(properties.getPrograms().getFfmpeg());
        command.addAll(ffmpeg.getCommonArgs());
        command.addAll(List.of("-analyzeduration", "10000000", "-probesize", "10000000", "-fflags", "+genpts"));
        command.addAll(List.of("-i", NetworkUtils.srtUrl(bindAddress, srtPort, "listener", ffmpeg.getInputLatency())));
        command.addAll(List.of("-c", "copy", "-f", "flv", "-flvflags", "no_duration_filesize"));
        command.add(properties.getRtmp().url());
        return command;
    }

    List<String> buildRelayCommand(int srtPort, String bindAddress) {
        var ffmpeg = properties.getFfmpeg();
        List<String> command = new ArrayList<>();
        command.add(properties.getPrograms().getFfmpeg());
        command.addAll(ffmpeg.getCommonArgs());
        command.addAll(List.of("-analyzeduration", "5000000", "-probesize", "5000000", "-fflags", "+genpts"));
        command.addAll(List.of("-re", "-i", properties.getRtmp().url()));
        command.addAll(List.of("-c", "copy", "-f", "mpegts"));
        command.add(NetworkUtils.srtUrl(bindAddress, srtPort, "listener", ffmpeg.getOutputLatency()));
        return command;
    }

    private Consumer<String> stdoutHandler(String processName) {
        Logger processLogger = LoggerFactory.getLogger(LOGGER_PREFIX + processName);
        return line -> {
            processLogger.info(line);
            if (line.contains("Stream #")) {
                log.debug("[{}] 检测到流", processName);
            }
            recordStats(processName, line);
        };
    }

    private Consumer<String> stderrHandler(String processName) {
        Logger processLogger = LoggerFactory.getLogger(LOGGER_PREFIX + processName);
        return line -> {
            // -stats 的进度行也写在 stderr 上
            if (recordStats(processName, line)) {
                processLogger.debug(line);
                return;
            }
            processLogger.warn(line);
            String lower = line.toLowerCase();
            if (!lower.contains("error") && !lower.contains("failed")) {
                return;
            }
            if (line.contains("Connection refused") || line.contains("Connection reset")) {
                log.error("[{}] 连接失败，可能需要重启", processName);
            } else if (line.contains("Invalid data")) {
                log.warn("[{}] 接收到无效数据", processName);
            } else if (!lower.contains("dimensions not set")) {
                log.error("[{}] FFmpeg错误: {}", processName, line);
            }
        };
    }

    private boolean recordStats(String processName, String line) {
        Optional<StreamStats> stats = parseStats(line);
        stats.ifPresent(s -> supervisor.updateStats(processName, s));
        return stats.isPresent();
    }

    /**
     * 从 ffmpeg 的进度行中解析 fps、bitrate 和 time。
     * 例如 "frame= 120 fps= 30 q=-1.0 size= 1024kB time=00:00:04.00 bitrate=2097.2kbits/s speed=1x"。
     *
     * @return 不是进度行时为空。
     */
    static Optional<StreamStats> parseStats(String line) {
        if (!line.contains("fps=")) {
            return Optional.empty();
        }
        Double fps = null;
        String fpsText = valueAfter(line, "fps=");
        if (fpsText != null) {
            try {
                fps = Double.parseDouble(fpsText);
            } catch (NumberFormatException e) {
                log.debug("无法解析帧率: {}", fpsText);
            }
        }
        return Optional.of(new StreamStats(fps, valueAfter(line, "bitrate="), valueAfter(line, "time=")));
    }

    private static String valueAfter(String line, String key) {
        int index = line.indexOf(key);
        if (index < 0) {
            return null;
        }
        String rest = line.substring(index + key.length()).stripLeading();
        if (rest.isEmpty()) {
            return null;
        }
        int end = 0;
        while (end < rest.length() && !Character.isWhitespace(rest.charAt(end))) {
            end++;
        }
        return rest.substring(0, end);
    }
}

/**
 * NginxService.java
 *
 * 管理本地的 nginx RTMP 服务器。nginx 会派生 worker 子进程，因此停止时总是终止整棵进程树。
 */
package club.ppmc.theater.service;

import club.ppmc.theater.config.TheaterProperties;
import club.ppmc.theater.exception.ErrorKind;
import club.ppmc.theater.exception.ProcessNotFoundException;
import club.ppmc.theater.exception.TheaterException;
import club.ppmc.theater.util.Executables;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class NginxService {

    public static final String PROCESS_NAME = "nginx_rtmp";

    private final ProcessSupervisor supervisor;
    private final TheaterProperties properties;

    public NginxService(ProcessSupervisor supervisor, TheaterProperties properties) {
        this.supervisor = supervisor;
        this.properties = properties;
    }

    /**
     * 启动 nginx，并在短暂等待后确认它没有立即退出。已在运行时直接返回。
     *
     * @throws TheaterException nginx 启动后立即退出。
     */
    public void start() {
        if (isRunning()) {
            log.warn("Nginx已在运行");
            return;
        }
        String executable = properties.getPrograms().getNginx();
        Executables.requirePresent("nginx", executable);

        Path workingDir = Path.of(executable).toAbsolutePath().getParent();
        supervisor.start(PROCESS_NAME, List.of(executable), workingDir, this::handleOutput, this::handleError, false);

        sleep(properties.getNginx().getSettleDelay().toMillis());
        if (!supervisor.isRunning(PROCESS_NAME)) {
            stopQuietly();
            throw new TheaterException(ErrorKind.PROCESS_LAUNCH_FAILED, "Nginx启动后立即退出");
        }
        log.info("Nginx RTMP服务器已启动 (端口: {})", properties.getRtmp().getPort());
    }

    public void stop() {
        if (!stopQuietly()) {
            log.warn("Nginx未在运行");
        }
    }

    public void restart() {
        log.debug("正在重启Nginx...");
        if (stopQuietly()) {
            // 等待端口释放
            sleep(properties.getNginx().getRestartDelay().toMillis());
        }
        start();
    }

    public boolean isRunning() {
        return supervisor.isRunning(PROCESS_NAME);
    }

    public String rtmpUrl() {
        return properties.getRtmp().url();
    }

    public String rtmpUrl(String streamKey) {
        return properties.getRtmp().url(streamKey);
    }

    private boolean stopQuietly() {
        try {
            supervisor.stopTree(PROCESS_NAME, properties.getNginx().getStopTimeout());
            log.debug("Nginx RTMP服务器已停止");
            return true;
        } catch (ProcessNotFoundException e) {
            return false;
        }
    }

    private void handleOutput(String line) {
        log.debug("[Nginx] {}", line);
    }

    private void handleError(String line) {
        // nginx 的部分普通信息也写在 stderr 上
        String lower = line.toLowerCase();
        if (lower.contains("error") || lower.contains("failed")) {
            log.error("[Nginx Error] {}", line);
        } else if (lower.contains("warning")) {
            log.warn("[Nginx Warning] {}", line);
        } else {
            log.debug("[Nginx] {}", line);
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

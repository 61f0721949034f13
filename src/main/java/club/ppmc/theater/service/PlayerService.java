/**
 * PlayerService.java
 *
 * 管理 mpv 播放器进程。
 * 发送端播放本地 RTMP 流作为预览，启动失败时按固定间隔持续重试；接收端以 caller 模式连接分配到的 SRT 端点。
 * 播放器启动后每隔一段时间检查一次进程是否还在，用户关闭播放器窗口时发布 {@link PlayerClosedEvent}。
 */
package club.ppmc.theater.service;

import club.ppmc.theater.config.TheaterProperties;
import club.ppmc.theater.exception.ErrorKind;
import club.ppmc.theater.exception.ProcessNotFoundException;
import club.ppmc.theater.exception.TheaterException;
import club.ppmc.theater.model.Role;
import club.ppmc.theater.model.event.PlayerClosedEvent;
import club.ppmc.theater.model.event.SessionErrorEvent;
import club.ppmc.theater.util.Executables;
import club.ppmc.theater.util.NetworkUtils;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class PlayerService {

    private final ProcessSupervisor supervisor;
    private final TheaterProperties properties;
    private final ApplicationEventPublisher events;
    private final ScheduledExecutorService scheduler;

    private final Map<Role, ScheduledFuture<?>> pending = new EnumMap<>(Role.class);
    private final Map<Role, ScheduledFuture<?>> watchers = new EnumMap<>(Role.class);

    public PlayerService(ProcessSupervisor supervisor, TheaterProperties properties, ApplicationEventPublisher events) {
        this.supervisor = supervisor;
        this.properties = properties;
        this.events = events;
        var counter = new AtomicInteger();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "player-watch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public static String processName(Role role) {
        return "mpv_" + role.wireName();
    }

    /**
     * 发送端预览：持续尝试播放本地 RTMP 流，直到播放器成功启动或调用 {@link #stop(Role)}。
     */
    public synchronized void playSenderPreview() {
        if (isPlaying(Role.SENDER) || pending.containsKey(Role.SENDER)) {
            log.warn("MPV已在播放");
            return;
        }
        String url = properties.getRtmp().url();
        long interval = properties.getPlayer().getSenderRetryInterval().toMillis();
        log.info("开始尝试播放RTMP流: {}", url);
        var attempts = new AtomicInteger();
        pending.put(Role.SENDER, scheduler.scheduleWithFixedDelay(() -> {
            synchronized (this) {
                // 已被 stop 取消
                if (!pending.containsKey(Role.SENDER)) {
                    return;
                }
                try {
                    launch(Role.SENDER, url);
                    cancelPending(Role.SENDER);
                } catch (TheaterException e) {
                    log.info("RTMP流暂不可用，{}毫秒后重试... (尝试 {}): {}",
                            interval, attempts.incrementAndGet(), e.getMessage());
                }
            }
        }, 0, interval, TimeUnit.MILLISECONDS));
    }

    /**
     * 接收端：立即启动播放器连接 SRT 端点。
     *
     * @throws TheaterException 播放器无法启动。
     */
    public synchronized void playReceiver(String host, int port) {
        if (isPlaying(Role.RECEIVER)) {
            log.warn("MPV已在播放");
            return;
        }
        launch(Role.RECEIVER, receiverUrl(host, port));
    }

    /**
     * 延迟一段时间后再启动接收端播放器，给服务端的中转进程留出开始监听的时间。
     * 启动失败时发布 {@link SessionErrorEvent}。
     */
    public synchronized void scheduleReceiver(String host, int port, Duration delay) {
        cancelPending(Role.RECEIVER);
        log.info("将在 {} 毫秒后播放 SRT 流 {}:{}", delay.toMillis(), host, port);
        pending.put(Role.RECEIVER, scheduler.schedule(() -> {
            synchronized (this) {
                pending.remove(Role.RECEIVER);
            }
            try {
                playReceiver(host, port);
            } catch (TheaterException e) {
                log.error("启动接收端播放器失败: {}", e.getMessage());
                events.publishEvent(new SessionErrorEvent(e.getKind(), e.getKind().getUserMessage()));
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * 停止指定角色的播放器，同时取消尚未执行的启动或重试。
     */
    public synchronized void stop(Role role) {
        cancelPending(role);
        cancelWatcher(role);
        try {
            supervisor.stop(processName(role));
            log.debug("MPV播放器已停止");
        } catch (ProcessNotFoundException e) {
            log.debug("MPV未在播放");
        }
    }

    public boolean isPlaying(Role role) {
        return supervisor.isRunning(processName(role));
    }

    String receiverUrl(String host, int port) {
        return NetworkUtils.srtUrl(host, port, "caller", properties.getPlayer().getReceiverLatency());
    }

    List<String> buildCommand(Role role, String url) {
        var player = properties.getPlayer();
        List<String> command = new ArrayList<>();
        command.add(properties.getPrograms().getMpv());
        command.addAll(role == Role.SENDER ? player.getSenderArgs() : player.getReceiverArgs());
        command.addAll(player.getCommonArgs());
        command.add(url);
        return command;
    }

    private synchronized void launch(Role role, String url) {
        Executables.requirePresent("mpv", properties.getPrograms().getMpv());
        String name = processName(role);
        supervisor.start(name, buildCommand(role, url), null, this::handleOutput, this::handleError, false);
        log.info("MPV播放器已启动: {}", url);
        watch(role);
    }

    private void watch(Role role) {
        cancelWatcher(role);
        long poll = properties.getPlayer().getPollInterval().toMillis();
        watchers.put(role, scheduler.scheduleWithFixedDelay(() -> {
            if (!supervisor.isRunning(processName(role))) {
                synchronized (this) {
                    cancelWatcher(role);
                }
                log.debug("MPV播放器已关闭");
                events.publishEvent(new PlayerClosedEvent(role));
            }
        }, poll, poll, TimeUnit.MILLISECONDS));
    }

    private void cancelPending(Role role) {
        ScheduledFuture<?> future = pending.remove(role);
        if (future != null) {
            future.cancel(false);
        }
    }

    private void cancelWatcher(Role role) {
        ScheduledFuture<?> future = watchers.remove(role);
        if (future != null) {
            future.cancel(false);
        }
    }

    private void handleOutput(String line) {
        if (line.contains("Playing:")) {
            log.debug("[MPV] 正在播放");
        } else if (line.contains("Video:") || line.contains("Audio:")) {
            log.debug("[MPV] 流信息已加载");
        }
    }

    private void handleError(String line) {
        String lower = line.toLowerCase();
        // 等待流就绪期间的 "No stream found" 不算错误
        if ((lower.contains("error") || lower.contains("failed")) && !line.contains("No stream found")) {
            log.error("[MPV] 播放错误: {}", line);
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (this) {
            pending.values().forEach(f -> f.cancel(false));
            pending.clear();
            watchers.values().forEach(f -> f.cancel(false));
            watchers.clear();
        }
        scheduler.shutdownNow();
    }
}

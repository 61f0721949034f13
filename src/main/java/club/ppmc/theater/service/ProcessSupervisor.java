/**
 * ProcessSupervisor.java
 *
 * 外部程序（ffmpeg、nginx、mpv）的统一监管器。
 * 负责启动、监控、自动重启、停止（包括整棵进程树）以及查询进程信息。
 *
 * 每个进程有一个监控 Future：它由 Process.onExit() 和每个输出流的读取 Future 组合而成，
 * 只有在进程退出且输出被完全读取之后才会处理退出逻辑。所有监控 Future 都登记在一个集合中，
 * {@link #stopAll(Duration)} 以它作为唯一的汇合点。
 */
package club.ppmc.theater.service;

import club.ppmc.theater.exception.ProcessAlreadyRunningException;
import club.ppmc.theater.exception.ProcessLaunchException;
import club.ppmc.theater.exception.ProcessNotFoundException;
import club.ppmc.theater.model.ManagedProcess;
import club.ppmc.theater.model.ProcessInfo;
import club.ppmc.theater.model.StreamStats;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import oshi.SystemInfo;
import oshi.software.os.OSProcess;

@Slf4j
public class ProcessSupervisor {

    private static final long BACKOFF_SLICE_MILLIS = 100;
    private static final Duration FORCE_KILL_WAIT = Duration.ofSeconds(2);
    // 进程被杀死后，监控任务收尾所需的额外时间
    private static final Duration MONITOR_GRACE = Duration.ofSeconds(5);

    private final Duration restartDelay;
    private final Duration defaultStopTimeout;

    private final Object lock = new Object();
    private final Map<String, ManagedProcess> processes = new HashMap<>();
    private final Set<CompletableFuture<Void>> monitors = ConcurrentHashMap.newKeySet();
    private final ExecutorService monitorPool;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    private volatile SystemInfo systemInfo;

    public ProcessSupervisor(Duration restartDelay, Duration defaultStopTimeout) {
        this.restartDelay = restartDelay;
        this.defaultStopTimeout = defaultStopTimeout;
        var counter = new AtomicInteger();
        this.monitorPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "process-monitor-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 启动一个被监管的进程。
     *
     * @param name           逻辑名称，在监管器内唯一。
     * @param command        可执行文件及其参数。
     * @param workingDir     工作目录，为 null 时继承当前目录。
     * @param onStdout       标准输出的逐行回调，为 null 时丢弃标准输出。
     * @param onStderr       标准错误的逐行回调，为 null 时丢弃标准错误。
     * @param restartOnExit  进程自行退出后是否按退避时间自动重启。
     * @throws ProcessAlreadyRunningException 该名称已被跟踪。
     * @throws ProcessLaunchException         操作系统拒绝启动该程序。
     * @throws IllegalStateException          监管器已经关闭。
     */
    public void start(
            String name,
            List<String> command,
            Path workingDir,
            Consumer<String> onStdout,
            Consumer<String> onStderr,
            boolean restartOnExit) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("命令不能为空");
        }
        var record = new ManagedProcess(name, command, workingDir, onStdout, onStderr, restartOnExit);
        synchronized (lock) {
            ensureOpen();
            if (processes.containsKey(name)) {
                throw new ProcessAlreadyRunningException(name);
            }
            launch(record);
            processes.put(name, record);
        }
    }

    public void stop(String name) {
        stop(name, defaultStopTimeout);
    }

    /**
     * 停止一个进程：先请求正常终止，超时后强制结束。无论结果如何，记录都会被移除。
     *
     * @throws ProcessNotFoundException 该名称未被跟踪。
     */
    public void stop(String name, Duration timeout) {
        Process process = detach(name);
        if (process == null) {
            log.info("进程 {} 正在等待重启，已取消", name);
            return;
        }
        log.debug("正在停止进程 {} (PID: {})", name, process.pid());
        process.destroy();
        try {
            if (process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("进程 {} 已停止", name);
                return;
            }
            log.warn("进程 {} 在 {} 秒内未响应，强制终止", name, timeout.toSeconds());
            process.destroyForcibly();
            process.waitFor(FORCE_KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    public void stopTree(String name) {
        stopTree(name, defaultStopTimeout);
    }

    /**
     * 停止一个进程及其所有子孙进程。用于 nginx 这类多进程程序。
     *
     * @throws ProcessNotFoundException 该名称未被跟踪。
     */
    public void stopTree(String name, Duration timeout) {
        Process process = detach(name);
        if (process == null) {
            return;
        }
        // 先取子孙进程，根进程退出后就无法再枚举
        List<ProcessHandle> tree = new ArrayList<>(process.descendants().toList());
        tree.forEach(ProcessHandle::destroy);
        process.destroy();
        tree.add(process.toHandle());
        log.debug("正在停止进程树 {}，共 {} 个进程", name, tree.size());

        CompletableFuture<?>[] exits = tree.stream()
                .map(ProcessHandle::onExit)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(exits).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("进程树 {} 已停止", name);
        } catch (TimeoutException e) {
            for (ProcessHandle handle : tree) {
                if (handle.isAlive()) {
                    log.warn("进程 {} (PID: {}) 未响应，强制终止", name, handle.pid());
                    handle.destroyForcibly();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tree.forEach(ProcessHandle::destroyForcibly);
        } catch (ExecutionException e) {
            log.warn("等待进程树 {} 退出时出错: {}", name, e.getMessage());
            tree.forEach(ProcessHandle::destroyForcibly);
        }
    }

    public boolean isRunning(String name) {
        synchronized (lock) {
            ManagedProcess record = processes.get(name);
            return record != null && record.isAlive();
        }
    }

    public List<String> getProcessNames() {
        synchronized (lock) {
            return List.copyOf(processes.keySet());
        }
    }

    /**
     * 读取一个进程的快照，操作系统层面的数据来自 OSHI。
     *
     * @return 未被跟踪时为空。
     */
    public Optional<ProcessInfo> getProcessInfo(String name) {
        ManagedProcess record;
        Process process;
        Instant startTime;
        synchronized (lock) {
            record = processes.get(name);
            if (record == null) {
                return Optional.empty();
            }
            process = record.getProcess();
            startTime = record.getStartTime();
        }

        boolean running = process != null && process.isAlive();
        long pid = process != null ? process.pid() : -1;
        long uptime = startTime != null && running ? Duration.between(startTime, Instant.now()).toSeconds() : 0;

        OSProcess osProcess = running ? queryOsProcess(pid) : null;
        return Optional.of(new ProcessInfo(
                name,
                pid,
                running,
                record.isRestartOnExit(),
                startTime,
                uptime,
                osProcess != null ? osProcess.getName() : null,
                osProcess != null ? osProcess.getState().name() : null,
                osProcess != null ? osProcess.getProcessCpuLoadCumulative() : null,
                osProcess != null ? osProcess.getResidentSetSize() : null,
                osProcess != null ? osProcess.getThreadCount() : null,
                record.getStats()));
    }

    /**
     * 记录一个进程最近一次的流统计信息。名称未被跟踪时忽略。
     */
    public void updateStats(String name, StreamStats stats) {
        synchronized (lock) {
            ManagedProcess record = processes.get(name);
            if (record != null) {
                record.setStats(stats);
            }
        }
    }

    public void stopAll() {
        stopAll(defaultStopTimeout);
    }

    /**
     * 停止所有被监管的进程，并阻塞到所有监控任务结束。调用后监管器不再接受新的进程。
     * 可以重复调用。
     */
    public void stopAll(Duration timeout) {
        shutdown.set(true);
        for (String name : getProcessNames()) {
            try {
                if (name.toLowerCase().contains("nginx")) {
                    stopTree(name, timeout);
                } else {
                    stop(name, timeout);
                }
            } catch (ProcessNotFoundException e) {
                log.debug("进程 {} 已在停止前退出", name);
            } catch (RuntimeException e) {
                log.error("停止进程 {} 时出错", name, e);
            }
        }
        awaitMonitors(timeout.plus(MONITOR_GRACE));
        log.debug("所有进程已停止");
    }

    /**
     * 应用关闭时调用：停止所有进程，然后关闭监控线程池。
     */
    public void shutdown() {
        stopAll(defaultStopTimeout);
        monitorPool.shutdown();
        try {
            if (!monitorPool.awaitTermination(1, TimeUnit.SECONDS)) {
                monitorPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            monitorPool.shutdownNow();
        }
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    // ---- 内部实现 ----

    private void ensureOpen() {
        if (shutdown.get()) {
            throw new IllegalStateException("进程监管器已关闭");
        }
    }

    /**
     * 从表中移除记录并标记为主动停止，返回需要终止的进程（退避期间为 null）。
     */
    private Process detach(String name) {
        synchronized (lock) {
            ManagedProcess record = processes.remove(name);
            if (record == null) {
                throw new ProcessNotFoundException(name);
            }
            record.setStopRequested(true);
            return record.getProcess();
        }
    }

    /** 必须在持有 lock 时调用。 */
    private void launch(ManagedProcess record) {
        var builder = new ProcessBuilder(record.getCommand())
                .redirectOutput(record.getStdoutCallback() != null
                        ? ProcessBuilder.Redirect.PIPE
                        : ProcessBuilder.Redirect.DISCARD)
                .redirectError(record.getStderrCallback() != null
                        ? ProcessBuilder.Redirect.PIPE
                        : ProcessBuilder.Redirect.DISCARD);
        if (record.getWorkingDirectory() != null) {
            builder.directory(record.getWorkingDirectory().toFile());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException | RuntimeException e) {
            log.error("启动进程 {} 失败，命令: {}", record.getName(), record.getCommand());
            throw new ProcessLaunchException(record.getName(), record.getCommand(), e);
        }
        closeStdin(process);

        record.setProcess(process);
        record.setStartTime(Instant.now());
        log.info("进程 {} 已启动 (PID: {}): {}", record.getName(), process.pid(), String.join(" ", record.getCommand()));
        monitor(record, process);
    }

    private void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("关闭进程 {} 的标准输入失败: {}", process.pid(), e.getMessage());
        }
    }

    private void monitor(ManagedProcess record, Process process) {
        CompletableFuture<Void> stdout = record.getStdoutCallback() != null
                ? readStream(record.getName(), process.getInputStream(), record.getStdoutCallback())
                : CompletableFuture.completedFuture(null);
        CompletableFuture<Void> stderr = record.getStderrCallback() != null
                ? readStream(record.getName(), process.getErrorStream(), record.getStderrCallback())
                : CompletableFuture.completedFuture(null);

        CompletableFuture<Void> monitor = process.onExit()
                .thenCombine(CompletableFuture.allOf(stdout, stderr), (p, v) -> p)
                .thenAcceptAsync(p -> handleExit(record, p), monitorPool)
                .exceptionally(ex -> {
                    log.error("监控进程 {} 时出错", record.getName(), ex);
                    return null;
                });
        monitors.add(monitor);
        monitor.whenComplete((v, ex) -> monitors.remove(monitor));
    }

    private CompletableFuture<Void> readStream(String name, InputStream stream, Consumer<String> callback) {
        return CompletableFuture.runAsync(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String trimmed = line.stripTrailing();
                    if (trimmed.isEmpty()) {
                        continue;
                    }
                    try {
                        callback.accept(trimmed);
                    } catch (RuntimeException e) {
                        log.warn("进程 {} 的输出回调抛出异常: {}", name, e.getMessage(), e);
                    }
                }
            } catch (IOException e) {
                // 进程被强制结束时流会被关闭
                log.debug("读取进程 {} 的输出时出错: {}", name, e.getMessage());
            }
        }, monitorPool);
    }

    private void handleExit(ManagedProcess record, Process process) {
        int exitCode = process.exitValue();
        String name = record.getName();
        synchronized (lock) {
            if (record.getProcess() != process) {
                return;
            }
            record.setProcess(null);
            boolean tracked = processes.get(name) == record;
            if (!tracked || record.isStopRequested()) {
                log.debug("进程 {} 已按请求停止，退出码: {}", name, exitCode);
                return;
            }
            if (!record.isRestartOnExit() || shutdown.get()) {
                processes.remove(name);
                logExit(name, exitCode);
                return;
            }
        }

        logExit(name, exitCode);
        log.info("进程 {} 将在 {} 毫秒后重启", name, restartDelay.toMillis());
        if (!awaitBackoff(record)) {
            log.debug("进程 {} 的重启已取消", name);
            return;
        }

        synchronized (lock) {
            if (shutdown.get() || record.isStopRequested() || processes.get(name) != record) {
                return;
            }
            try {
                launch(record);
            } catch (ProcessLaunchException e) {
                processes.remove(name);
                log.error("重启进程 {} 失败，不再重试: {}", name, e.getMessage());
            }
        }
    }

    private void logExit(String name, int exitCode) {
        if (exitCode != 0) {
            log.warn("进程 {} 异常退出，退出码: {}", name, exitCode);
        } else {
            log.info("进程 {} 正常退出", name);
        }
    }

    /**
     * 分片等待退避时间，期间一旦发生关闭或主动停止就立即放弃。
     *
     * @return 等待完整结束时为 true。
     */
    private boolean awaitBackoff(ManagedProcess record) {
        long deadline = System.nanoTime() + restartDelay.toNanos();
        while (true) {
            if (shutdown.get() || isStopRequested(record)) {
                return false;
            }
            long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMillis <= 0) {
                return true;
            }
            try {
                Thread.sleep(Math.min(BACKOFF_SLICE_MILLIS, remainingMillis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private boolean isStopRequested(ManagedProcess record) {
        synchronized (lock) {
            return record.isStopRequested();
        }
    }

    private void awaitMonitors(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        // 退避中的重启可能在等待期间登记新的监控任务，因此循环直到集合为空
        while (!monitors.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("仍有 {} 个进程监控任务未结束", monitors.size());
                return;
            }
            try {
                CompletableFuture.allOf(monitors.toArray(CompletableFuture[]::new))
                        .get(remaining, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                log.warn("等待进程监控任务结束超时");
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException e) {
                log.debug("进程监控任务异常结束: {}", e.getMessage());
            }
        }
    }

    private OSProcess queryOsProcess(long pid) {
        try {
            if (systemInfo == null) {
                systemInfo = new SystemInfo();
            }
            return systemInfo.getOperatingSystem().getProcess((int) pid);
        } catch (RuntimeException | LinkageError e) {
            log.debug("读取进程 {} 的系统信息失败: {}", pid, e.getMessage());
            return null;
        }
    }
}

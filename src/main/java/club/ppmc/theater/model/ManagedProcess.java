/**
 * ManagedProcess.java
 *
 * ProcessSupervisor 内部为每个逻辑名称维护的进程记录。
 * 在自动重启的退避期间，process 为 null，但记录仍然存在；
 * 显式停止、全局清理，或不需要重启的进程自然退出时，记录被移除。
 * 除 stats 外，所有可变字段都只在 ProcessSupervisor 的锁内读写。
 */
package club.ppmc.theater.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;
import lombok.Getter;
import lombok.Setter;

@Getter
public class ManagedProcess {

    private final String name;
    private final List<String> command;
    private final Path workingDirectory;
    private final Consumer<String> stdoutCallback;
    private final Consumer<String> stderrCallback;
    private final boolean restartOnExit;

    @Setter private Process process;
    @Setter private Instant startTime;
    @Setter private boolean stopRequested;
    @Setter private volatile StreamStats stats;

    public ManagedProcess(
            String name,
            List<String> command,
            Path workingDirectory,
            Consumer<String> stdoutCallback,
            Consumer<String> stderrCallback,
            boolean restartOnExit) {
        this.name = name;
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.stdoutCallback = stdoutCallback;
        this.stderrCallback = stderrCallback;
        this.restartOnExit = restartOnExit;
    }

    public boolean isAlive() {
        return process != null && process.isAlive();
    }
}

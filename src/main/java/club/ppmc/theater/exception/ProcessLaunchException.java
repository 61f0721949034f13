/**
 * ProcessLaunchException.java
 *
 * 外部程序启动失败（可执行文件不存在、无权限等）时抛出。
 * 只表示"启动"本身失败，与进程后续的运行结果无关。
 */
package club.ppmc.theater.exception;

import java.util.List;
import lombok.Getter;

@Getter
public class ProcessLaunchException extends TheaterException {

    private final String processName;
    private final List<String> command;

    public ProcessLaunchException(String processName, List<String> command, Throwable cause) {
        super(ErrorKind.PROCESS_LAUNCH_FAILED, "启动进程 " + processName + " 失败: " + cause.getMessage(), cause);
        this.processName = processName;
        this.command = List.copyOf(command);
    }
}

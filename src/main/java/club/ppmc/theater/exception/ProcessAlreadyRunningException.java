/**
 * ProcessAlreadyRunningException.java
 *
 * 当以一个已被跟踪的逻辑名称再次启动进程时抛出。
 */
package club.ppmc.theater.exception;

import lombok.Getter;

@Getter
public class ProcessAlreadyRunningException extends TheaterException {

    private final String processName;

    public ProcessAlreadyRunningException(String processName) {
        super(ErrorKind.PROCESS_LAUNCH_FAILED, "进程 " + processName + " 已存在");
        this.processName = processName;
    }
}

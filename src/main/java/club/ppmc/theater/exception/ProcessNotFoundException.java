/**
 * ProcessNotFoundException.java
 *
 * 当停止或查询一个未被跟踪的进程名称时抛出。
 */
package club.ppmc.theater.exception;

import lombok.Getter;

@Getter
public class ProcessNotFoundException extends TheaterException {

    private final String processName;

    public ProcessNotFoundException(String processName) {
        super(ErrorKind.SERVER_ERROR, "进程 " + processName + " 不存在");
        this.processName = processName;
    }
}

/**
 * PortExhaustedException.java
 *
 * 在给定的探测范围内没有找到任何可用端口时抛出。
 */
package club.ppmc.theater.exception;

import lombok.Getter;

@Getter
public class PortExhaustedException extends TheaterException {

    private final int startPort;
    private final int attempts;

    public PortExhaustedException(int startPort, int attempts) {
        super(ErrorKind.PORT_EXHAUSTED,
                String.format("从端口 %d 开始探测 %d 次后仍未找到可用端口", startPort, attempts));
        this.startPort = startPort;
        this.attempts = attempts;
    }
}

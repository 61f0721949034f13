/**
 * TheaterException.java
 *
 * 放映室核心所有业务异常的基类。
 * 它携带一个 {@link ErrorKind}，Controller 层和信令层据此向用户展示友好的提示，
 * 而不是直接暴露内部异常信息。
 */
package club.ppmc.theater.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class TheaterException extends RuntimeException {

    private final ErrorKind kind;

    public TheaterException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TheaterException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * 将异常转换为可序列化的错误数据，供REST接口返回。
     *
     * @return 包含错误类别和用户提示的Map。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", kind.name(),
                "message", kind.getUserMessage()
        );
    }
}

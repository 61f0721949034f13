/**
 * ProtocolViolationException.java
 *
 * 信令消息无法解析、类型未知或缺少必需字段时抛出。
 * 服务端收到此类消息只回复 error，不会关闭连接；客户端只记录日志并忽略。
 */
package club.ppmc.theater.exception;

public class ProtocolViolationException extends TheaterException {

    public ProtocolViolationException(String message) {
        super(ErrorKind.PROTOCOL_VIOLATION, message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(ErrorKind.PROTOCOL_VIOLATION, message, cause);
    }
}

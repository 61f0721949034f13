/**
 * ErrorKind.java
 *
 * 放映室核心可能出现的错误类别。
 * 每个类别都对应一条面向用户的提示文本，界面层只展示这些文本，原始异常信息只写入日志。
 */
package club.ppmc.theater.exception;

public enum ErrorKind {

    /** 验证码错误，对该连接是终止性的，不会自动重试。 */
    AUTHENTICATION_FAILED("验证码错误，请重新输入"),

    /** 昵称重复。会自动追加后缀解决，从不作为错误上报。 */
    NICKNAME_COLLISION("昵称已被使用，请更换"),

    /** 没有找到可用的流端口。 */
    PORT_EXHAUSTED("端口被占用，请更换端口"),

    /** 外部程序缺失或启动失败。 */
    PROCESS_LAUNCH_FAILED("视频流启动失败"),

    /** 传输层断开。客户端会有限次重连，服务端只做清理。 */
    TRANSPORT_DISCONNECTED("连接失败，请检查网络设置"),

    /** 未认证就发送消息，或消息格式错误。 */
    PROTOCOL_VIOLATION("消息格式错误"),

    /** 服务端返回的其他错误。 */
    SERVER_ERROR("服务器错误，请稍后重试");

    private final String userMessage;

    ErrorKind(String userMessage) {
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}

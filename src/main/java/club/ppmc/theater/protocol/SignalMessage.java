/**
 * SignalMessage.java
 *
 * 信令通道上的所有消息。
 * 消息只在传输边界由 {@link SignalCodec} 解析一次，之后的业务代码只处理这里定义的记录类型。
 * 字段名与线上 JSON 保持一致，需要下划线的字段通过 {@link SerializedName} 映射。
 */
package club.ppmc.theater.protocol;

import club.ppmc.theater.model.Member;
import com.google.gson.annotations.SerializedName;
import java.util.List;

public interface SignalMessage {

    MessageType type();

    /** 客户端 -> 服务端：携带验证码和期望的昵称。 */
    record Auth(String code, String nickname) implements SignalMessage {
        @Override
        public MessageType type() {
            return MessageType.AUTH;
        }
    }

    /** 服务端 -> 客户端：认证成功，告知最终昵称和分配到的流端点。 */
    record AuthSuccess(
            String nickname,
            @SerializedName("srt_port") int srtPort,
            @SerializedName("server_ip") String serverIp)
            implements SignalMessage {
        @Override
        public MessageType type() {
            return MessageType.AUTH_SUCCESS;
        }
    }

    record AuthFailed(String message) implements SignalMessage {
        @Override
        public MessageType type() {
            return MessageType.AUTH_FAILED;
        }
    }

    /**
     * 聊天消息。客户端发出时只有 message；服务端广播时补全 nickname 和 timestamp。
     */
    record Chat(String nickname, String message, String timestamp) implements SignalMessage {

        public static Chat outgoing(String message) {
            return new Chat(null, message, null);
        }

        @Override
        public MessageType type() {
            return MessageType.CHAT;
        }
    }

    record Join(String nickname, String message) implements SignalMessage {
        @Override
        public MessageType type() {
            return MessageType.JOIN;
        }
    }

    record Leave(String nickname, String message) implements SignalMessage {
        @Override
        public MessageType type() {
            return MessageType.LEAVE;
        }
    }

    record Members(List<Member> members) implements SignalMessage {

        public Members {
            members = List.copyOf(members);
        }

        @Override
        public MessageType type() {
            return MessageType.MEMBERS;
        }
    }

    /** 服务端 -> 客户端：更新流端点。 */
    record SrtPort(
            @SerializedName("srt_port") int srtPort,
            @SerializedName("server_ip") String serverIp)
            implements SignalMessage {
        @Override
        public MessageType type() {
            return MessageType.SRT_PORT;
        }
    }

    /** 对应线上的 "error" 类型。 */
    record ServerError(String message) implements SignalMessage {
        @Override
        public MessageType type() {
            return MessageType.ERROR;
        }
    }

    record Heartbeat() implements SignalMessage {
        @Override
        public MessageType type() {
            return MessageType.HEARTBEAT;
        }
    }
}

/**
 * MessageType.java
 *
 * 信令消息的类型，以及它们在线上 JSON 中 "type" 字段的取值。
 */
package club.ppmc.theater.protocol;

import java.util.Optional;

public enum MessageType {
    AUTH("auth"),
    AUTH_SUCCESS("auth_success"),
    AUTH_FAILED("auth_failed"),
    CHAT("chat"),
    JOIN("join"),
    LEAVE("leave"),
    MEMBERS("members"),
    SRT_PORT("srt_port"),
    ERROR("error"),
    HEARTBEAT("heartbeat");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWireName(String wireName) {
        for (MessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

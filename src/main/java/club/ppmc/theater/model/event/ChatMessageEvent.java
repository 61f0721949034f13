/**
 * ChatMessageEvent.java
 *
 * 收到一条聊天消息（或由加入/离开产生的系统消息）时发布的事件。
 */
package club.ppmc.theater.model.event;

/**
 * @param nickname  发送者昵称，系统消息为 "系统"。
 * @param message   消息正文。
 * @param timestamp ISO-8601 格式的本地时间。
 * @param system    是否为系统消息。
 */
public record ChatMessageEvent(String nickname, String message, String timestamp, boolean system) {

    public static final String SYSTEM_NICKNAME = "系统";

    public static ChatMessageEvent system(String message, String timestamp) {
        return new ChatMessageEvent(SYSTEM_NICKNAME, message, timestamp, true);
    }
}

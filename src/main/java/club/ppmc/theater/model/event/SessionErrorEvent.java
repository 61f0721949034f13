/**
 * SessionErrorEvent.java
 *
 * 会话出错时发布。terminal 为 true 表示客户端已经放弃重连，不会再有后续尝试。
 */
package club.ppmc.theater.model.event;

import club.ppmc.theater.exception.ErrorKind;

public record SessionErrorEvent(ErrorKind kind, String message, boolean terminal) {

    public SessionErrorEvent(ErrorKind kind, String message) {
        this(kind, message, false);
    }
}

/**
 * DisconnectedEvent.java
 *
 * 已建立的信令连接意外断开时发布。
 */
package club.ppmc.theater.model.event;

public record DisconnectedEvent(String reason) {}

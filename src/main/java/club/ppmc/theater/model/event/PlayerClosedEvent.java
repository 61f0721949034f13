/**
 * PlayerClosedEvent.java
 *
 * 播放器窗口被用户关闭（进程自行退出）时发布。
 */
package club.ppmc.theater.model.event;

import club.ppmc.theater.model.Role;

public record PlayerClosedEvent(Role role) {}

/**
 * AuthenticatedEvent.java
 *
 * 观众端认证成功后发布，每次成功认证只发布一次。
 *
 * @param nickname   服务端最终分配的昵称（可能带有 _k 后缀）。
 * @param serverIp   服务端通告的流地址。
 * @param srtPort    分配给该观众的 SRT 端口。
 * @param serverHost 客户端连接信令服务时使用的主机名，serverIp 不可用时作为回退。
 */
package club.ppmc.theater.model.event;

public record AuthenticatedEvent(String nickname, String serverIp, int srtPort, String serverHost) {}

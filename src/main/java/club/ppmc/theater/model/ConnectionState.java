/**
 * ConnectionState.java
 *
 * 服务端视角下单个信令连接的状态。DISCONNECTED 是终止状态。
 */
package club.ppmc.theater.model;

public enum ConnectionState {
    CONNECTED,
    AUTHENTICATING,
    AUTHENTICATED,
    DISCONNECTED
}

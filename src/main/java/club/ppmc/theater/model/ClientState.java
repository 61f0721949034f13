/**
 * ClientState.java
 *
 * 观众端信令客户端的状态机。
 */
package club.ppmc.theater.model;

public enum ClientState {
    IDLE,
    CONNECTING,
    CONNECTED,
    AUTHENTICATING,
    AUTHENTICATED,
    RECONNECTING,
    DISCONNECTED
}

/**
 * ViewerStatus.java
 *
 * 观众端的连接状态，由 /api/viewer/status 返回。
 */
package club.ppmc.theater.model;

public record ViewerStatus(
        ClientState state,
        String nickname,
        String serverIp,
        Integer srtPort,
        int reconnectAttempts,
        boolean playing) {}

/**
 * HostStatus.java
 *
 * 房主端的运行状态，由 /api/host/status 返回。
 */
package club.ppmc.theater.model;

import java.util.List;

public record HostStatus(
        boolean open,
        String nickname,
        String advertisedAddress,
        int srtInputPort,
        int signalingPort,
        boolean nginxRunning,
        boolean ingestRunning,
        boolean previewPlaying,
        List<Member> members) {}

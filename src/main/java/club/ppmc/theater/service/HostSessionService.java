/**
 * HostSessionService.java
 *
 * 房主端的编排服务。开启放映室的顺序是：nginx RTMP 服务器 -> SRT 输入转换进程 -> 信令会话 -> 本地预览播放器。
 * 任何一步失败都会按相反顺序回滚已经启动的部分。
 */
package club.ppmc.theater.service;

import club.ppmc.theater.config.TheaterProperties;
import club.ppmc.theater.model.HostStartRequest;
import club.ppmc.theater.model.HostStatus;
import club.ppmc.theater.model.Member;
import club.ppmc.theater.model.Role;
import club.ppmc.theater.util.Executables;
import club.ppmc.theater.util.NicknameGenerator;
import jakarta.annotation.PreDestroy;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class HostSessionService {

    private final NginxService nginxService;
    private final FfmpegService ffmpegService;
    private final PlayerService playerService;
    private final SessionCoordinator coordinator;
    private final TheaterProperties properties;

    private boolean running;
    private String nickname;
    private int srtInputPort;

    public HostSessionService(
            NginxService nginxService,
            FfmpegService ffmpegService,
            PlayerService playerService,
            SessionCoordinator coordinator,
            TheaterProperties properties) {
        this.nginxService = nginxService;
        this.ffmpegService = ffmpegService;
        this.playerService = playerService;
        this.coordinator = coordinator;
        this.properties = properties;
    }

    /**
     * 开启放映室。
     *
     * @throws IllegalStateException 放映室已经开启。
     */
    public synchronized HostStatus start(HostStartRequest request) {
        if (running) {
            throw new IllegalStateException("放映室已开启");
        }
        var network = properties.getNetwork();
        String hostNickname = request.nickname() == null || request.nickname().isBlank()
                ? NicknameGenerator.randomNickname()
                : request.nickname().trim();
        int inputPort = request.srtInputPort() != null ? request.srtInputPort() : network.getSrtInputPort();
        String bind = request.bindAddress() == null || request.bindAddress().isBlank()
                ? network.getBindAddress()
                : request.bindAddress().trim();
        boolean localPlay = request.enableLocalPlay() != null
                ? request.enableLocalPlay()
                : network.isEnableLocalPlay();

        Executables.requirePresent("ffmpeg", properties.getPrograms().getFfmpeg());
        Executables.requirePresent("nginx", properties.getPrograms().getNginx());
        if (localPlay) {
            Executables.requirePresent("mpv", properties.getPrograms().getMpv());
        }

        boolean nginxStarted = false;
        boolean ingestStarted = false;
        try {
            nginxService.start();
            nginxStarted = true;
            ffmpegService.startIngest(inputPort, bind);
            ingestStarted = true;
            coordinator.open(hostNickname, request.verificationCode(), bind);
            if (localPlay) {
                playerService.playSenderPreview();
            }
        } catch (RuntimeException e) {
            log.error("开启放映室失败，正在回滚: {}", e.getMessage());
            coordinator.close();
            if (ingestStarted) {
                ffmpegService.stopIngest();
            }
            if (nginxStarted) {
                nginxService.stop();
            }
            throw e;
        }

        running = true;
        nickname = hostNickname;
        srtInputPort = inputPort;
        log.info("放映室已开启: 房主 {}，SRT输入端口 {}，信令端口 {}", hostNickname, inputPort, network.getWebsocketPort());
        return status();
    }

    /**
     * 关闭放映室并停止所有相关进程。未开启时什么也不做。
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        playerService.stop(Role.SENDER);
        coordinator.close();
        ffmpegService.stopIngest();
        nginxService.stop();
        running = false;
        log.info("放映室已关闭");
    }

    public synchronized HostStatus status() {
        return new HostStatus(
                running,
                nickname,
                coordinator.getAdvertisedAddress(),
                srtInputPort,
                properties.getNetwork().getWebsocketPort(),
                nginxService.isRunning(),
                ffmpegService.isRunning(FfmpegService.INGEST_PROCESS),
                playerService.isPlaying(Role.SENDER),
                coordinator.getMembers());
    }

    public List<Member> members() {
        return coordinator.getMembers();
    }

    /**
     * 房主发送聊天消息。
     *
     * @return 放映室未开启时为 false。
     */
    public boolean chat(String message) {
        return coordinator.sendHostChat(message);
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }
}

/**
 * ViewerSessionService.java
 *
 * 观众端的编排服务。它持有当前的 {@link SessionClient}，在认证成功后延迟启动接收端播放器，
 * 断开时停止播放器和客户端。
 */
package club.ppmc.theater.service;

import club.ppmc.theater.config.TheaterProperties;
import club.ppmc.theater.exception.ErrorKind;
import club.ppmc.theater.exception.TheaterException;
import club.ppmc.theater.model.ClientState;
import club.ppmc.theater.model.Role;
import club.ppmc.theater.model.ViewerConnectRequest;
import club.ppmc.theater.model.ViewerStatus;
import club.ppmc.theater.model.event.AuthenticatedEvent;
import club.ppmc.theater.model.event.SessionErrorEvent;
import club.ppmc.theater.protocol.SignalCodec;
import club.ppmc.theater.util.NetworkUtils;
import club.ppmc.theater.util.NicknameGenerator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.client.WebSocketClient;

@Service
@Slf4j
public class ViewerSessionService {

    private final WebSocketClient webSocketClient;
    private final SignalCodec codec;
    private final ApplicationEventPublisher events;
    private final PlayerService playerService;
    private final TheaterProperties properties;

    private SessionClient client;

    public ViewerSessionService(
            WebSocketClient webSocketClient,
            SignalCodec codec,
            ApplicationEventPublisher events,
            PlayerService playerService,
            TheaterProperties properties) {
        this.webSocketClient = webSocketClient;
        this.codec = codec;
        this.events = events;
        this.playerService = playerService;
        this.properties = properties;
    }

    /**
     * 连接到一个放映室。已有连接时先断开旧连接。
     */
    public synchronized ViewerStatus connect(ViewerConnectRequest request) {
        NetworkUtils.HostAndPort address = NetworkUtils.parseAddress(request.serverAddress());
        if (address.host().isBlank()) {
            throw new IllegalArgumentException("服务器地址不能为空");
        }
        int port = address.port().orElse(properties.getNetwork().getWebsocketPort());
        String nickname = request.nickname() == null || request.nickname().isBlank()
                ? NicknameGenerator.randomNickname()
                : request.nickname().trim();

        releaseClient();
        client = new SessionClient(webSocketClient, codec, events, properties.getNetwork());
        client.connect(address.host(), port, nickname, request.verificationCode());
        log.info("正在以 {} 的身份加入放映室 {}:{}", nickname, address.host(), port);
        return status();
    }

    public synchronized void disconnect() {
        releaseClient();
    }

    public synchronized ViewerStatus status() {
        if (client == null) {
            return new ViewerStatus(ClientState.IDLE, null, null, null, 0, false);
        }
        return new ViewerStatus(
                client.getState(),
                client.getNickname(),
                client.getServerIp(),
                client.getSrtPort(),
                client.getReconnectAttempts(),
                playerService.isPlaying(Role.RECEIVER));
    }

    /**
     * 发送聊天消息。
     *
     * @throws TheaterException 尚未通过认证。
     */
    public synchronized void chat(String message) {
        if (client == null || !client.isAuthenticated()) {
            throw new TheaterException(ErrorKind.TRANSPORT_DISCONNECTED, "尚未加入放映室");
        }
        client.sendChat(message);
    }

    /**
     * 认证成功后，等待服务端的中转进程开始监听，再启动接收端播放器。
     * 服务端通告的是通配地址或空地址时，改用连接信令服务时的主机名。
     */
    @EventListener
    public void onAuthenticated(AuthenticatedEvent event) {
        String host = event.serverIp() == null || NetworkUtils.isWildcard(event.serverIp())
                ? event.serverHost()
                : event.serverIp();
        playerService.scheduleReceiver(host, event.srtPort(), properties.getPlayer().getReceiverStartDelay());
    }

    @EventListener
    public void onSessionError(SessionErrorEvent event) {
        if (event.terminal()) {
            playerService.stop(Role.RECEIVER);
        }
    }

    private void releaseClient() {
        if (client != null) {
            playerService.stop(Role.RECEIVER);
            client.shutdown();
            client = null;
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        releaseClient();
    }
}

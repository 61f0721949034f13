/**
 * SessionCoordinator.java
 *
 * 发送端（房主）的信令服务，挂载在内嵌服务器的根路径上。
 * 它负责观众的身份验证、昵称去重、SRT 端口分配、为每位观众启动独立的中转进程、聊天消息的广播，
 * 以及连接断开后的清理。
 *
 * 连接表、昵称集合和端口游标都由同一把锁保护；消息的实际发送经由每个连接自己的发送链在共享线程池上执行，
 * 因此广播在不同连接之间是并发的，而同一连接上的消息始终保持顺序。
 */
package club.ppmc.theater.service;

import club.ppmc.theater.config.TheaterProperties;
import club.ppmc.theater.exception.ErrorKind;
import club.ppmc.theater.exception.PortExhaustedException;
import club.ppmc.theater.exception.ProtocolViolationException;
import club.ppmc.theater.exception.TheaterException;
import club.ppmc.theater.model.ClientRecord;
import club.ppmc.theater.model.ConnectionState;
import club.ppmc.theater.model.HostSession;
import club.ppmc.theater.model.Member;
import club.ppmc.theater.model.Role;
import club.ppmc.theater.model.event.ChatMessageEvent;
import club.ppmc.theater.model.event.MembersChangedEvent;
import club.ppmc.theater.protocol.SignalCodec;
import club.ppmc.theater.protocol.SignalMessage;
import club.ppmc.theater.util.NetworkUtils;
import club.ppmc.theater.util.NicknameGenerator;
import club.ppmc.theater.util.PortAllocator;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Service
@Slf4j
public class SessionCoordinator extends TextWebSocketHandler {

    static final String NOT_AUTHENTICATED = "请先进行身份验证";
    static final String WRONG_CODE = "验证码错误";
    static final String NO_PORT = "无法分配SRT端口";
    static final String RELAY_FAILED = "无法启动流转发服务";
    static final String NOT_OPEN = "放映室尚未开启";

    private static final int MAX_PORT = 65535;

    private final SignalCodec codec;
    private final FfmpegService ffmpegService;
    private final PortAllocator portAllocator;
    private final TheaterProperties properties;
    private final ApplicationEventPublisher events;
    private final Executor sendExecutor;

    private final Object lock = new Object();
    private HostSession session;

    public SessionCoordinator(
            SignalCodec codec,
            FfmpegService ffmpegService,
            PortAllocator portAllocator,
            TheaterProperties properties,
            ApplicationEventPublisher events,
            @Qualifier("signalingExecutor") Executor sendExecutor) {
        this.codec = codec;
        this.ffmpegService = ffmpegService;
        this.portAllocator = portAllocator;
        this.properties = properties;
        this.events = events;
        this.sendExecutor = sendExecutor;
    }

    // ---- 会话生命周期 ----

    /**
     * 开启放映室。开启后才接受观众连接。
     *
     * @param hostNickname     房主昵称，总是以 sender 角色出现在成员列表首位。
     * @param verificationCode 观众加入时需要提供的验证码。
     * @param bindAddress      中转进程的 SRT 绑定地址。
     * @throws IllegalStateException 放映室已经开启。
     */
    public void open(String hostNickname, String verificationCode, String bindAddress) {
        String advertised = resolveAdvertisedAddress(bindAddress);
        List<Member> roster;
        synchronized (lock) {
            if (session != null) {
                throw new IllegalStateException("放映室已开启");
            }
            session = new HostSession(
                    verificationCode,
                    hostNickname,
                    bindAddress,
                    advertised,
                    properties.getNetwork().getSrtBasePort(),
                    Instant.now());
            roster = roster(session);
        }
        log.info("放映室已开启，房主: {}，通告地址: {}", hostNickname, advertised);
        events.publishEvent(new MembersChangedEvent(roster));
    }

    /**
     * 关闭放映室：停止所有观众的中转进程并断开所有连接。可以重复调用。
     */
    public void close() {
        HostSession closing;
        List<ClientRecord> clients;
        synchronized (lock) {
            closing = session;
            session = null;
            if (closing == null) {
                return;
            }
            clients = new ArrayList<>(closing.getClients().values());
            closing.getClients().clear();
            for (ClientRecord client : clients) {
                client.setState(ConnectionState.DISCONNECTED);
            }
        }
        for (ClientRecord client : clients) {
            if (client.getRelayProcessName() != null) {
                ffmpegService.stop(client.getRelayProcessName());
            }
            client.close(CloseStatus.GOING_AWAY, sendExecutor);
        }
        log.info("放映室已关闭，断开了 {} 个连接", clients.size());
    }

    public boolean isOpen() {
        synchronized (lock) {
            return session != null;
        }
    }

    /** 当前成员列表，放映室未开启时为空。 */
    public List<Member> getMembers() {
        synchronized (lock) {
            return session == null ? List.of() : roster(session);
        }
    }

    public String getAdvertisedAddress() {
        synchronized (lock) {
            return session == null ? null : session.getAdvertisedAddress();
        }
    }

    /**
     * 房主发送聊天消息，以房主昵称广播给所有已认证的观众。
     *
     * @return 放映室未开启时为 false。
     */
    public boolean sendHostChat(String message) {
        String nickname;
        synchronized (lock) {
            if (session == null) {
                return false;
            }
            nickname = session.getHostNickname();
        }
        broadcastChat(nickname, message);
        return true;
    }

    // ---- WebSocket 回调 ----

    @Override
    public void afterConnectionEstablished(WebSocketSession webSocketSession) {
        var record = new ClientRecord(webSocketSession, Instant.now());
        synchronized (lock) {
            if (session != null) {
                session.getClients().put(record.getConnectionId(), record);
                log.info("新客户端连接: {} 来自 {}", record.getConnectionId(), record.getRemoteAddress());
                return;
            }
        }
        log.warn("放映室未开启，拒绝连接 {}", record.getRemoteAddress());
        reject(record, new SignalMessage.ServerError(NOT_OPEN), CloseStatus.SERVICE_RESTARTED);
    }

    @Override
    protected void handleTextMessage(WebSocketSession webSocketSession, TextMessage textMessage) {
        ClientRecord record;
        boolean authenticated;
        synchronized (lock) {
            record = session == null ? null : session.getClients().get(webSocketSession.getId());
            if (record == null) {
                return;
            }
            authenticated = record.isAuthenticated();
        }

        SignalMessage message;
        try {
            message = codec.decode(textMessage.getPayload());
        } catch (ProtocolViolationException e) {
            log.warn("来自 {} 的无效消息: {}", record.getConnectionId(), e.getMessage());
            sendError(record, ErrorKind.PROTOCOL_VIOLATION.getUserMessage());
            return;
        }

        if (!authenticated) {
            if (message instanceof SignalMessage.Auth auth) {
                authenticate(record, auth);
            } else {
                sendError(record, NOT_AUTHENTICATED);
            }
            return;
        }

        if (message instanceof SignalMessage.Chat chat) {
            String nickname;
            synchronized (lock) {
                nickname = record.getNickname();
            }
            broadcastChat(nickname, chat.message());
        } else if (message instanceof SignalMessage.Heartbeat) {
            record.send(codec.encode(new SignalMessage.Heartbeat()), sendExecutor);
        } else {
            log.warn("来自 {} 的未知消息类型: {}", record.getNickname(), message.type().wireName());
            sendError(record, "不支持的消息类型: " + message.type().wireName());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession webSocketSession, Throwable exception) {
        log.debug("连接 {} 传输出错: {}", webSocketSession.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession webSocketSession, CloseStatus status) {
        String connectionId = webSocketSession.getId();
        String relay;
        boolean wasAuthenticated;
        synchronized (lock) {
            ClientRecord record = session == null ? null : session.getClients().get(connectionId);
            if (record == null || record.getState() == ConnectionState.DISCONNECTED) {
                return;
            }
            // 标记为已断开后，之后到达的 auth 不会再为它启动中转进程
            wasAuthenticated = record.isAuthenticated();
            relay = record.getRelayProcessName();
            record.setState(ConnectionState.DISCONNECTED);
        }
        // 先停止中转进程，记录仍在表中，端口不会被分给别人
        if (relay != null) {
            ffmpegService.stop(relay);
        }

        String nickname;
        List<Member> roster;
        synchronized (lock) {
            HostSession current = session;
            ClientRecord record = current == null ? null : current.getClients().remove(connectionId);
            if (record == null) {
                return;
            }
            if (!wasAuthenticated) {
                log.debug("未认证的客户端已断开: {}", connectionId);
                return;
            }
            nickname = record.getNickname();
            current.getNicknames().remove(nickname);
            broadcast(current, new SignalMessage.Leave(nickname, nickname + " 离开了放映室"), null);
            roster = roster(current);
            broadcast(current, new SignalMessage.Members(roster), null);
        }
        log.info("客户端断开连接: {} ({})", nickname, status);
        events.publishEvent(new MembersChangedEvent(roster));
    }

    // ---- 内部实现 ----

    private void authenticate(ClientRecord record, SignalMessage.Auth auth) {
        List<Member> roster;
        String nickname;
        int port;
        synchronized (lock) {
            HostSession current = session;
            if (current == null
                    || current.getClients().get(record.getConnectionId()) != record
                    || record.getState() != ConnectionState.CONNECTED) {
                return;
            }
            record.setState(ConnectionState.AUTHENTICATING);

            if (!current.getVerificationCode().equals(auth.code())) {
                log.warn("客户端 {} 验证码错误", record.getRemoteAddress());
                dropUnderLock(current, record);
                reject(record, new SignalMessage.AuthFailed(WRONG_CODE), CloseStatus.NORMAL);
                return;
            }

            nickname = uniqueNickname(current, auth.nickname());
            try {
                port = allocatePort(current);
            } catch (PortExhaustedException e) {
                log.error("无法为 {} 分配SRT端口: {}", nickname, e.getMessage());
                dropUnderLock(current, record);
                reject(record, new SignalMessage.ServerError(NO_PORT), CloseStatus.SERVER_ERROR);
                return;
            }

            String relay = "client_" + nickname + "_" + port;
            try {
                ffmpegService.startViewerRelay(relay, port, current.getBindAddress());
            } catch (TheaterException e) {
                log.error("为 {} 启动中转进程失败: {}", nickname, e.getMessage());
                dropUnderLock(current, record);
                reject(record, new SignalMessage.ServerError(RELAY_FAILED), CloseStatus.SERVER_ERROR);
                return;
            }

            // 所有步骤成功后才提交
            record.setNickname(nickname);
            record.setSrtPort(port);
            record.setRelayProcessName(relay);
            record.setState(ConnectionState.AUTHENTICATED);
            current.getNicknames().add(nickname);
            current.setNextPort(port + 1 > MAX_PORT ? properties.getNetwork().getSrtBasePort() : port + 1);

            record.send(codec.encode(new SignalMessage.AuthSuccess(nickname, port, current.getAdvertisedAddress())),
                    sendExecutor);
            broadcast(current, new SignalMessage.Join(nickname, nickname + " 加入了放映室"), record);
            roster = roster(current);
            broadcast(current, new SignalMessage.Members(roster), null);
        }
        log.info("客户端认证成功: {} (SRT端口: {})", nickname, port);
        events.publishEvent(new MembersChangedEvent(roster));
    }

    /** 必须在持有 lock 时调用。 */
    private String uniqueNickname(HostSession current, String requested) {
        String base = requested == null || requested.isBlank()
                ? NicknameGenerator.randomNickname()
                : requested.trim();
        if (!current.getNicknames().contains(base)) {
            return base;
        }
        int counter = 2;
        while (current.getNicknames().contains(base + "_" + counter)) {
            counter++;
        }
        String nickname = base + "_" + counter;
        log.info("昵称重复，自动更改为: {}", nickname);
        return nickname;
    }

    /**
     * 从端口游标开始探测，跳过仍有中转进程的观众端口，超过 65535 时回到起始端口。
     * 必须在持有 lock 时调用。
     *
     * @throws PortExhaustedException 探测次数用完仍未找到可用端口。
     */
    private int allocatePort(HostSession current) {
        int basePort = properties.getNetwork().getSrtBasePort();
        int attempts = properties.getNetwork().getPortProbeAttempts();
        Set<Integer> held = new HashSet<>();
        for (ClientRecord client : current.getClients().values()) {
            // 正在断开的观众在中转进程停止前仍占用端口
            if (client.getRelayProcessName() != null) {
                held.add(client.getSrtPort());
            }
        }
        int candidate = current.getNextPort();
        for (int i = 0; i < attempts; i++) {
            if (candidate > MAX_PORT) {
                candidate = basePort;
            }
            if (!held.contains(candidate) && portAllocator.isPortAvailable(candidate)) {
                return candidate;
            }
            candidate++;
        }
        throw new PortExhaustedException(current.getNextPort(), attempts);
    }

    private void broadcastChat(String nickname, String message) {
        String timestamp = LocalDateTime.now().toString();
        synchronized (lock) {
            if (session == null) {
                return;
            }
            broadcast(session, new SignalMessage.Chat(nickname, message, timestamp), null);
        }
        events.publishEvent(new ChatMessageEvent(nickname, message, timestamp, false));
    }

    /**
     * 向所有已认证的连接排队发送一条消息。必须在持有 lock 时调用，以保证各连接上的消息顺序与事件顺序一致。
     *
     * @param excluded 不发送的连接，可以为 null。
     */
    private void broadcast(HostSession current, SignalMessage message, ClientRecord excluded) {
        String payload = codec.encode(message);
        for (ClientRecord client : current.getClients().values()) {
            if (client != excluded && client.isAuthenticated()) {
                client.send(payload, sendExecutor);
            }
        }
    }

    private void sendError(ClientRecord record, String message) {
        record.send(codec.encode(new SignalMessage.ServerError(message)), sendExecutor);
    }

    private void reject(ClientRecord record, SignalMessage message, CloseStatus status) {
        record.send(codec.encode(message), sendExecutor);
        record.close(status, sendExecutor);
    }

    private void dropUnderLock(HostSession current, ClientRecord record) {
        current.getClients().remove(record.getConnectionId());
        record.setState(ConnectionState.DISCONNECTED);
    }

    private List<Member> roster(HostSession current) {
        List<Member> members = new ArrayList<>();
        members.add(new Member(current.getHostNickname(), Role.SENDER));
        for (ClientRecord client : current.getClients().values()) {
            if (client.isAuthenticated()) {
                members.add(new Member(client.getNickname(), Role.RECEIVER));
            }
        }
        return members;
    }

    private String resolveAdvertisedAddress(String bindAddress) {
        String advertised = properties.getNetwork().getAdvertisedAddress();
        if (advertised != null && !advertised.isBlank()) {
            return advertised.trim();
        }
        if (!NetworkUtils.isWildcard(bindAddress)) {
            return bindAddress;
        }
        return NetworkUtils.getLocalIp(properties.getNetwork().isPreferIpv6());
    }
}

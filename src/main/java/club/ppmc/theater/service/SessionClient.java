/**
 * SessionClient.java
 *
 * 观众端的信令客户端。
 * 每个实例拥有一个单线程事件循环：连接、认证、消息处理、心跳、重连以及事件发布都在这个线程上执行，
 * 调用方的方法只是向循环提交任务，不会阻塞，也可以在事件处理函数中安全调用。
 *
 * 每次建立传输都会递增一个代号，来自旧连接的回调会被直接丢弃。
 * 意外断开或连接失败后按固定间隔重连，连续失败超过上限后发布终止性的错误事件并停止。
 */
package club.ppmc.theater.service;

import club.ppmc.theater.config.TheaterProperties;
import club.ppmc.theater.exception.ErrorKind;
import club.ppmc.theater.exception.ProtocolViolationException;
import club.ppmc.theater.model.ClientState;
import club.ppmc.theater.model.event.AuthenticatedEvent;
import club.ppmc.theater.model.event.ChatMessageEvent;
import club.ppmc.theater.model.event.DisconnectedEvent;
import club.ppmc.theater.model.event.MembersChangedEvent;
import club.ppmc.theater.model.event.SessionErrorEvent;
import club.ppmc.theater.protocol.SignalCodec;
import club.ppmc.theater.protocol.SignalMessage;
import club.ppmc.theater.util.NetworkUtils;
import java.io.IOException;
import java.net.URI;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Slf4j
public class SessionClient {

    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final WebSocketClient webSocketClient;
    private final SignalCodec codec;
    private final ApplicationEventPublisher events;
    private final TheaterProperties.Network settings;
    private final ScheduledExecutorService loop;

    // 以下字段只在事件循环线程上写入
    private volatile ClientState state = ClientState.IDLE;
    private volatile String nickname;
    private volatile Integer srtPort;
    private volatile String serverIp;
    private volatile int reconnectAttempts;

    private String host;
    private int port;
    private String requestedNickname;
    private String verificationCode;
    private WebSocketSession transport;
    private int generation;
    private boolean reconnectEnabled;
    private boolean disconnectedByUser;
    private ScheduledFuture<?> pendingReconnect;
    private ScheduledFuture<?> heartbeat;

    public SessionClient(
            WebSocketClient webSocketClient,
            SignalCodec codec,
            ApplicationEventPublisher events,
            TheaterProperties.Network settings) {
        this.webSocketClient = webSocketClient;
        this.codec = codec;
        this.events = events;
        this.settings = settings;
        int id = INSTANCES.incrementAndGet();
        this.loop = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "session-client-" + id);
            thread.setDaemon(true);
            return thread;
        });
    }

    // ---- 公共接口：只向事件循环提交任务 ----

    /**
     * 连接到放映室并发送认证请求。结果通过事件通知。
     *
     * @param host     服务端地址，IPv6 地址可以带或不带方括号。
     * @param port     信令端口。
     * @param nickname 期望的昵称，服务端可能追加后缀。
     * @param code     验证码。
     */
    public void connect(String host, int port, String nickname, String code) {
        execute(() -> {
            if (disconnectedByUser) {
                log.warn("客户端已被主动断开，不能再次连接");
                return;
            }
            if (state != ClientState.IDLE && state != ClientState.DISCONNECTED) {
                log.warn("客户端已在连接中，忽略新的连接请求");
                return;
            }
            this.host = host;
            this.port = port;
            this.requestedNickname = nickname;
            this.verificationCode = code;
            this.reconnectEnabled = true;
            this.reconnectAttempts = 0;
            openTransport();
        });
    }

    /**
     * 发送聊天消息。未认证时忽略。
     */
    public void sendChat(String message) {
        execute(() -> {
            if (state != ClientState.AUTHENTICATED) {
                log.debug("未认证，丢弃聊天消息");
                return;
            }
            send(SignalMessage.Chat.outgoing(message));
        });
    }

    /**
     * 主动断开连接并永久关闭自动重连，此后 connect 会被忽略。可以重复调用。
     */
    public void disconnect() {
        execute(() -> {
            disconnectedByUser = true;
            closeLocally();
        });
    }

    /**
     * 断开连接并停止事件循环。之后此实例不能再使用。
     */
    public void shutdown() {
        disconnect();
        loop.shutdown();
    }

    public ClientState getState() {
        return state;
    }

    public boolean isAuthenticated() {
        return state == ClientState.AUTHENTICATED;
    }

    public String getNickname() {
        return nickname;
    }

    public Integer getSrtPort() {
        return srtPort;
    }

    public String getServerIp() {
        return serverIp;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    // ---- 事件循环内部 ----

    private void execute(Runnable task) {
        try {
            loop.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("信令客户端处理任务时出错", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("信令客户端已关闭，忽略任务");
        }
    }

    private void openTransport() {
        int current = ++generation;
        state = ClientState.CONNECTING;
        URI uri = NetworkUtils.webSocketUri(host, port);
        log.info("正在连接到服务器: {}", uri);

        CompletableFuture<WebSocketSession> future;
        try {
            future = webSocketClient.execute(new TransportHandler(current), new WebSocketHttpHeaders(), uri);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.orTimeout(settings.getConnectionTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((session, ex) -> execute(() -> onTransportResult(current, session, ex)));
    }

    private void onTransportResult(int gen, WebSocketSession session, Throwable ex) {
        if (gen != generation) {
            closeQuietly(session);
            return;
        }
        if (ex != null) {
            log.warn("连接服务器失败: {}", ex.getMessage());
            // 超时后握手仍可能完成，让迟到的连接成为过期连接
            generation++;
            transport = null;
            scheduleReconnect();
            return;
        }
        transport = session;
        state = ClientState.CONNECTED;
        log.info("已连接到服务器，正在认证...");
        state = ClientState.AUTHENTICATING;
        send(new SignalMessage.Auth(verificationCode, requestedNickname));
    }

    private void onMessage(int gen, String payload) {
        if (gen != generation) {
            return;
        }
        SignalMessage message;
        try {
            message = codec.decode(payload);
        } catch (ProtocolViolationException e) {
            log.warn("忽略无法解析的消息: {}", e.getMessage());
            return;
        }

        if (message instanceof SignalMessage.AuthSuccess success) {
            onAuthSuccess(success);
        } else if (message instanceof SignalMessage.AuthFailed failed) {
            log.error("认证失败: {}", failed.message());
            closeLocally();
            events.publishEvent(new SessionErrorEvent(
                    ErrorKind.AUTHENTICATION_FAILED, ErrorKind.AUTHENTICATION_FAILED.getUserMessage(), true));
        } else if (message instanceof SignalMessage.Chat chat) {
            String timestamp = chat.timestamp() != null ? chat.timestamp() : LocalDateTime.now().toString();
            events.publishEvent(new ChatMessageEvent(chat.nickname(), chat.message(), timestamp, false));
        } else if (message instanceof SignalMessage.Join join) {
            String text = join.message() != null ? join.message() : join.nickname() + " 加入了放映室";
            events.publishEvent(ChatMessageEvent.system(text, LocalDateTime.now().toString()));
        } else if (message instanceof SignalMessage.Leave leave) {
            String text = leave.message() != null ? leave.message() : leave.nickname() + " 离开了放映室";
            events.publishEvent(ChatMessageEvent.system(text, LocalDateTime.now().toString()));
        } else if (message instanceof SignalMessage.Members members) {
            events.publishEvent(new MembersChangedEvent(members.members()));
        } else if (message instanceof SignalMessage.ServerError error) {
            String text = error.message() != null ? error.message() : "未知错误";
            log.error("服务器错误: {}", text);
            events.publishEvent(new SessionErrorEvent(ErrorKind.SERVER_ERROR, text));
        } else if (message instanceof SignalMessage.SrtPort update) {
            srtPort = update.srtPort();
            if (update.serverIp() != null) {
                serverIp = update.serverIp();
            }
            log.info("服务器更新了流端点: {}:{}", serverIp, srtPort);
        } else if (message instanceof SignalMessage.Heartbeat) {
            log.debug("收到心跳响应");
        } else {
            log.warn("忽略未知消息类型: {}", message.type().wireName());
        }
    }

    private void onAuthSuccess(SignalMessage.AuthSuccess success) {
        if (state == ClientState.AUTHENTICATED) {
            log.warn("重复的认证成功消息，已忽略");
            return;
        }
        state = ClientState.AUTHENTICATED;
        nickname = success.nickname();
        srtPort = success.srtPort();
        serverIp = success.serverIp();
        reconnectAttempts = 0;
        startHeartbeat();
        log.info("认证成功: {} (SRT端口: {})", nickname, srtPort);
        events.publishEvent(new AuthenticatedEvent(nickname, serverIp, srtPort, host));
    }

    private void onClosed(int gen, CloseStatus status) {
        if (gen != generation) {
            return;
        }
        transport = null;
        stopHeartbeat();
        log.warn("与服务器的连接已断开: {}", status);
        if (!reconnectEnabled) {
            state = ClientState.DISCONNECTED;
            return;
        }
        events.publishEvent(new DisconnectedEvent(status.toString()));
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (!reconnectEnabled) {
            state = ClientState.DISCONNECTED;
            return;
        }
        int max = settings.getMaxReconnectAttempts();
        if (reconnectAttempts >= max) {
            log.error("重连 {} 次后仍然失败，停止重连", max);
            reconnectEnabled = false;
            state = ClientState.DISCONNECTED;
            events.publishEvent(new SessionErrorEvent(
                    ErrorKind.TRANSPORT_DISCONNECTED, ErrorKind.TRANSPORT_DISCONNECTED.getUserMessage(), true));
            return;
        }
        reconnectAttempts++;
        state = ClientState.RECONNECTING;
        long interval = settings.getReconnectInterval().toMillis();
        log.info("{} 毫秒后尝试第 {}/{} 次重连", interval, reconnectAttempts, max);
        pendingReconnect = loop.schedule(() -> {
            pendingReconnect = null;
            if (reconnectEnabled) {
                openTransport();
            }
        }, interval, TimeUnit.MILLISECONDS);
    }

    private void closeLocally() {
        reconnectEnabled = false;
        generation++;
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
        stopHeartbeat();
        WebSocketSession session = transport;
        transport = null;
        closeQuietly(session);
        if (state != ClientState.IDLE && state != ClientState.DISCONNECTED) {
            state = ClientState.DISCONNECTED;
            log.info("已断开与服务器的连接");
        }
    }

    private void startHeartbeat() {
        stopHeartbeat();
        long interval = settings.getHeartbeatInterval().toMillis();
        heartbeat = loop.scheduleAtFixedRate(() -> {
            if (state == ClientState.AUTHENTICATED) {
                send(new SignalMessage.Heartbeat());
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat() {
        if (heartbeat != null) {
            heartbeat.cancel(false);
            heartbeat = null;
        }
    }

    private void send(SignalMessage message) {
        WebSocketSession session = transport;
        if (session == null || !session.isOpen()) {
            log.debug("连接不可用，丢弃 {} 消息", message.type().wireName());
            return;
        }
        try {
            session.sendMessage(new TextMessage(codec.encode(message)));
        } catch (IOException | RuntimeException e) {
            log.warn("发送 {} 消息失败: {}", message.type().wireName(), e.getMessage());
        }
    }

    private static void closeQuietly(WebSocketSession session) {
        if (session == null || !session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException | RuntimeException e) {
            log.debug("关闭连接时出错: {}", e.getMessage());
        }
    }

    /**
     * 把传输层的回调转交给事件循环，并带上所属连接的代号。
     */
    private class TransportHandler extends TextWebSocketHandler {

        private final int gen;

        TransportHandler(int gen) {
            this.gen = gen;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            execute(() -> {
                if (gen != generation) {
                    closeQuietly(session);
                }
            });
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            String payload = message.getPayload();
            execute(() -> onMessage(gen, payload));
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            log.debug("信令传输出错: {}", exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            execute(() -> onClosed(gen, status));
        }
    }
}

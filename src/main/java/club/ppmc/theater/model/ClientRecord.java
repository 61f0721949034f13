/**
 * ClientRecord.java
 *
 * 服务端为每个信令连接维护的记录。
 * 除了认证状态、分配到的昵称和端口之外，它还持有一条按顺序执行的发送链：
 * 同一连接上的消息总是按提交顺序发出，而不同连接之间的发送互不阻塞。
 * 字段的读写由 SessionCoordinator 的会话锁保护，发送链自身是线程安全的。
 */
package club.ppmc.theater.model;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@Slf4j
@Getter
public class ClientRecord {

    private final String connectionId;
    private final WebSocketSession session;
    private final Instant connectedAt;
    private final String remoteAddress;

    @Setter private ConnectionState state = ConnectionState.CONNECTED;
    @Setter private String nickname;
    @Setter private int srtPort;
    @Setter private String relayProcessName;

    // 发送链的尾部，新消息总是接在它后面
    private CompletableFuture<Void> outbound = CompletableFuture.completedFuture(null);

    public ClientRecord(WebSocketSession session, Instant connectedAt) {
        this.connectionId = session.getId();
        this.session = session;
        this.connectedAt = connectedAt;
        this.remoteAddress = session.getRemoteAddress() != null
                ? session.getRemoteAddress().toString()
                : "unknown";
    }

    public boolean isAuthenticated() {
        return state == ConnectionState.AUTHENTICATED;
    }

    /**
     * 将一条文本消息追加到该连接的发送链上。
     * 发送失败只记录日志，不会中断发送链，也不会影响其他连接。
     *
     * @param payload  已编码的JSON文本。
     * @param executor 执行实际发送的线程池。
     * @return 在这条消息发送完成（或失败）后完成的 Future。
     */
    public synchronized CompletableFuture<Void> send(String payload, Executor executor) {
        outbound = outbound.thenRunAsync(() -> deliver(payload), executor);
        return outbound;
    }

    /**
     * 在所有已排队的消息发出之后关闭连接。
     */
    public synchronized CompletableFuture<Void> close(CloseStatus status, Executor executor) {
        outbound = outbound.thenRunAsync(() -> closeSession(status), executor);
        return outbound;
    }

    private void deliver(String payload) {
        if (!session.isOpen()) {
            log.debug("连接 {} 已关闭，丢弃待发送消息", connectionId);
            return;
        }
        try {
            session.sendMessage(new TextMessage(payload));
        } catch (IOException | RuntimeException e) {
            log.warn("向连接 {} ({}) 发送消息失败: {}", connectionId, nickname, e.getMessage());
        }
    }

    private void closeSession(CloseStatus status) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException | RuntimeException e) {
            log.debug("关闭连接 {} 时出错: {}", connectionId, e.getMessage());
        }
    }
}

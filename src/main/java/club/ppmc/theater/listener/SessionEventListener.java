/**
 * SessionEventListener.java
 *
 * 这是一个Spring事件监听器，订阅放映室核心发布的所有事件并写入日志。
 * 界面层可以用同样的方式订阅这些事件；事件可能来自任意线程，切换到界面线程是订阅者自己的责任。
 */
package club.ppmc.theater.listener;

import club.ppmc.theater.model.Role;
import club.ppmc.theater.model.event.AuthenticatedEvent;
import club.ppmc.theater.model.event.ChatMessageEvent;
import club.ppmc.theater.model.event.DisconnectedEvent;
import club.ppmc.theater.model.event.MembersChangedEvent;
import club.ppmc.theater.model.event.PlayerClosedEvent;
import club.ppmc.theater.model.event.SessionErrorEvent;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class SessionEventListener {

    @EventListener
    public void onChat(ChatMessageEvent event) {
        if (event.system()) {
            log.info("[系统] {}", event.message());
        } else {
            log.info("[聊天] {}: {}", event.nickname(), event.message());
        }
    }

    @EventListener
    public void onMembersChanged(MembersChangedEvent event) {
        String names = event.members().stream()
                .map(m -> m.nickname() + "(" + m.role().wireName() + ")")
                .collect(Collectors.joining(", "));
        log.info("成员列表已更新 ({} 人): {}", event.members().size(), names);
    }

    @EventListener
    public void onAuthenticated(AuthenticatedEvent event) {
        log.info("已加入放映室: {}，流地址 {}:{}", event.nickname(), event.serverIp(), event.srtPort());
    }

    @EventListener
    public void onError(SessionErrorEvent event) {
        if (event.terminal()) {
            log.error("会话已终止 [{}]: {}", event.kind(), event.message());
        } else {
            log.warn("会话错误 [{}]: {}", event.kind(), event.message());
        }
    }

    @EventListener
    public void onDisconnected(DisconnectedEvent event) {
        log.warn("信令连接已断开: {}", event.reason());
    }

    @EventListener
    public void onPlayerClosed(PlayerClosedEvent event) {
        log.info("{} 播放器已关闭", event.role() == Role.SENDER ? "发送端" : "接收端");
    }
}

/**
 * WebSocketConfig.java
 *
 * 注册信令端点。
 * 信令协议是每帧一个 JSON 对象的原始 WebSocket，因此这里不使用 STOMP，而是直接把
 * {@link SessionCoordinator} 挂在根路径 "/" 上，端口由 server.port 决定。
 */
package club.ppmc.theater.config;

import club.ppmc.theater.service.SessionCoordinator;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SessionCoordinator sessionCoordinator;

    public WebSocketConfig(SessionCoordinator sessionCoordinator) {
        this.sessionCoordinator = sessionCoordinator;
    }

    /**
     * 观众端是桌面程序而不是浏览器，不会携带 Origin 头；允许所有来源，访问控制由验证码完成。
     */
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(sessionCoordinator, "/").setAllowedOrigins("*");
    }
}

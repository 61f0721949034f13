/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义应用级别的 Bean：信令编解码用的 Gson、进程监管器、信令发送线程池，以及观众端使用的 WebSocket 客户端。
 */
package club.ppmc.theater.config;

import club.ppmc.theater.service.ProcessSupervisor;
import com.google.gson.Gson;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

@Configuration
@EnableConfigurationProperties(TheaterProperties.class)
public class AppConfig {

    /**
     * 定义一个全局的 Gson Bean。
     * 用于信令消息的 JSON 编解码。
     *
     * @return 一个新的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new Gson();
    }

    /**
     * 进程监管器。应用关闭时会停止所有被监管的外部程序，并等待监控任务全部结束。
     */
    @Bean(destroyMethod = "shutdown")
    public ProcessSupervisor processSupervisor(TheaterProperties properties) {
        return new ProcessSupervisor(
                properties.getProcess().getRestartDelay(),
                properties.getProcess().getStopTimeout());
    }

    /**
     * 信令消息的发送线程池。
     * 每个连接的消息在自己的发送链上按顺序执行，不同连接之间并发。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService signalingExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "signal-send-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public WebSocketClient webSocketClient() {
        return new StandardWebSocketClient();
    }
}

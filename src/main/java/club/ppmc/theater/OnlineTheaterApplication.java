/**
 * OnlineTheaterApplication.java
 *
 * 在线放映室的主启动类。
 * 内嵌服务器同时承担两项职责：根路径上的信令 WebSocket 端点，以及 /api 下的控制接口。
 */
package club.ppmc.theater;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OnlineTheaterApplication {

    public static void main(String[] args) {
        SpringApplication.run(OnlineTheaterApplication.class, args);
    }
}

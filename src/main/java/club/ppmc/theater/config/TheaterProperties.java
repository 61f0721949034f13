/**
 * TheaterProperties.java
 *
 * 放映室的所有可配置项，绑定 application.properties 中以 "theater" 为前缀的属性。
 * 默认值与早期版本的硬编码常量保持一致；各服务通过构造函数注入此对象，而不是读取全局状态。
 */
package club.ppmc.theater.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "theater")
public class TheaterProperties {

    private Network network = new Network();
    private Programs programs = new Programs();
    private Rtmp rtmp = new Rtmp();
    private Ffmpeg ffmpeg = new Ffmpeg();
    private Player player = new Player();
    private ProcessSettings process = new ProcessSettings();
    private Nginx nginx = new Nginx();

    @Data
    public static class Network {
        /** 信令端口，同时作为内嵌服务器的 server.port。 */
        private int websocketPort = 10086;
        /** 发送端接收 SRT 推流的端口。 */
        private int srtInputPort = 9001;
        /** 为观众分配 SRT 端口的起始值。 */
        private int srtBasePort = 10000;
        /** 每次分配端口时的最大探测次数。 */
        private int portProbeAttempts = 100;
        private String verificationCode = "114514";
        /** 中转进程和信令服务的绑定地址。 */
        private String bindAddress = "0.0.0.0";
        /** 通告给观众的流地址，为空时使用绑定地址或自动探测的本机地址。 */
        private String advertisedAddress = "";
        private boolean enableLocalPlay = true;
        private boolean preferIpv6 = true;
        private Duration connectionTimeout = Duration.ofSeconds(10);
        private Duration reconnectInterval = Duration.ofSeconds(3);
        private int maxReconnectAttempts = 5;
        private Duration heartbeatInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Programs {
        private String ffmpeg = "ffmpeg";
        private String mpv = "mpv";
        private String nginx = "rtmp/nginx";
    }

    @Data
    public static class Rtmp {
        private String host = "127.0.0.1";
        private int port = 1935;
        private String appName = "live";
        private String streamKey = "stream";

        /** 本地 RTMP 流地址，例如 rtmp://127.0.0.1:1935/live/stream。 */
        public String url(String key) {
            return "rtmp://" + host + ":" + port + "/" + appName + "/" + key;
        }

        public String url() {
            return url(streamKey);
        }
    }

    @Data
    public static class Ffmpeg {
        /** 发送端 SRT 输入的延迟（毫秒）。 */
        private int inputLatency = 120;
        /** 观众 SRT 输出的延迟（毫秒）。 */
        private int outputLatency = 3000;
        private List<String> commonArgs =
                new ArrayList<>(List.of("-hide_banner", "-loglevel", "warning", "-stats", "-nostdin"));
    }

    @Data
    public static class Player {
        private int receiverLatency = 3000;
        private Duration senderRetryInterval = Duration.ofSeconds(3);
        /** 观众认证成功后延迟多久启动播放器，等待中转进程开始监听。 */
        private Duration receiverStartDelay = Duration.ofSeconds(5);
        private Duration pollInterval = Duration.ofSeconds(1);
        private List<String> senderArgs = new ArrayList<>(List.of(
                "--cache=yes",
                "--cache-secs=300",
                "--demuxer-max-bytes=150M",
                "--demuxer-max-back-bytes=75M",
                "--hwdec=auto",
                "--vo=gpu",
                "--gpu-api=auto",
                "--video-sync=audio",
                "--keep-open=yes",
                "--force-window=yes",
                "--osc=yes",
                "--osd-bar=yes",
                "--network-timeout=60",
                "--stream-lavf-o=rtmp_live=1",
                "--title=在线放映室 - 发送端"));
        private List<String> receiverArgs = new ArrayList<>(List.of(
                "--cache=yes",
                "--cache-secs=300",
                "--demuxer-max-bytes=150M",
                "--demuxer-max-back-bytes=75M",
                "--hwdec=auto",
                "--vo=gpu",
                "--gpu-api=auto",
                "--video-sync=audio",
                "--keep-open=no",
                "--force-window=immediate",
                "--osc=yes",
                "--osd-bar=yes",
                "--network-timeout=60",
                "--demuxer-lavf-o=protocol_whitelist=[srt,crypto,file,rtp,tcp,udp]",
                "--title=在线放映室 - 接收端"));
        private List<String> commonArgs = new ArrayList<>(List.of(
                "--input-default-bindings=yes",
                "--input-vo-keyboard=yes",
                "--sub-auto=fuzzy",
                "--audio-channels=stereo",
                "--volume=100",
                "--volume-max=150",
                "--msg-level=all=info"));
    }

    @Data
    public static class ProcessSettings {
        /** 自动重启前的等待时间。 */
        private Duration restartDelay = Duration.ofSeconds(3);
        private Duration stopTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Nginx {
        /** 启动后等待多久再检查进程是否存活。 */
        private Duration settleDelay = Duration.ofSeconds(1);
        /** 重启时等待端口释放的时间。 */
        private Duration restartDelay = Duration.ofSeconds(2);
        private Duration stopTimeout = Duration.ofSeconds(5);
    }
}

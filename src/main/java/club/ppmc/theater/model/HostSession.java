/**
 * HostSession.java
 *
 * 发送端开启放映室后持有的会话状态：验证码、房主昵称、所有连接、已占用昵称和端口游标。
 * 它只在 SessionCoordinator 的会话锁内被访问，因此使用普通集合。
 */
package club.ppmc.theater.model;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;

@Getter
public class HostSession {

    private final String verificationCode;
    private final String hostNickname;
    private final String bindAddress;
    private final String advertisedAddress;
    private final Instant openedAt;

    /** connection-id -> ClientRecord，保持连接建立的顺序。 */
    private final Map<String, ClientRecord> clients = new LinkedHashMap<>();

    /** 已占用的昵称，包括房主自己。 */
    private final Set<String> nicknames = new HashSet<>();

    /** 下一次分配端口时开始探测的位置。 */
    @Setter private int nextPort;

    public HostSession(
            String verificationCode,
            String hostNickname,
            String bindAddress,
            String advertisedAddress,
            int basePort,
            Instant openedAt) {
        this.verificationCode = verificationCode;
        this.hostNickname = hostNickname;
        this.bindAddress = bindAddress;
        this.advertisedAddress = advertisedAddress;
        this.nextPort = basePort;
        this.openedAt = openedAt;
        this.nicknames.add(hostNickname);
    }
}

/**
 * PortAllocator.java
 *
 * 端口探测工具。从给定端口开始向上逐个尝试，直到找到一个在 IPv4 和 IPv6 通配地址上都能监听的端口。
 * 它不做任何持久的预留：探测用的套接字会立即关闭，调用方拿到端口后应尽快使用。
 */
package club.ppmc.theater.util;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.UnknownHostException;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PortAllocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PortAllocator.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 100;
    private static final int MAX_PORT = 65535;

    private final InetAddress ipv4Wildcard;
    private final InetAddress ipv6Wildcard;

    public PortAllocator() {
        this.ipv4Wildcard = literal("0.0.0.0");
        this.ipv6Wildcard = detectIpv6Stack();
        if (ipv6Wildcard == null) {
            LOGGER.warn("当前主机没有可用的 IPv6 协议栈，端口探测只检查 IPv4。");
        }
    }

    public OptionalInt findAvailablePort(int startPort) {
        return findAvailablePort(startPort, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * 从 startPort 开始升序探测，最多尝试 maxAttempts 次，且不会超过 65535。
     *
     * @param startPort   起始端口。
     * @param maxAttempts 最大尝试次数。
     * @return 第一个可用的端口；没有找到时为空。
     */
    public OptionalInt findAvailablePort(int startPort, int maxAttempts) {
        if (startPort < 1 || startPort > MAX_PORT) {
            throw new IllegalArgumentException("起始端口超出范围: " + startPort);
        }
        int lastPort = (int) Math.min((long) startPort + maxAttempts - 1, MAX_PORT);
        for (int port = startPort; port <= lastPort; port++) {
            if (isPortAvailable(port)) {
                return OptionalInt.of(port);
            }
        }
        LOGGER.warn("从端口 {} 开始探测 {} 次后没有找到可用端口", startPort, maxAttempts);
        return OptionalInt.empty();
    }

    /**
     * 检查端口是否可用。IPv4 和 IPv6 任一绑定失败都视为不可用。
     */
    public boolean isPortAvailable(int port) {
        if (!canListen(ipv4Wildcard, port)) {
            return false;
        }
        return ipv6Wildcard == null || canListen(ipv6Wildcard, port);
    }

    public boolean isIpv6Supported() {
        return ipv6Wildcard != null;
    }

    private static boolean canListen(InetAddress address, int port) {
        try (var socket = new ServerSocket()) {
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(address, port), 1);
            return true;
        } catch (IOException e) {
            LOGGER.trace("端口 {} 在 {} 上不可用: {}", port, address.getHostAddress(), e.getMessage());
            return false;
        }
    }

    private static InetAddress detectIpv6Stack() {
        InetAddress any6 = literal("::");
        try (var socket = new ServerSocket()) {
            socket.bind(new InetSocketAddress(any6, 0), 1);
            return any6;
        } catch (IOException e) {
            return null;
        }
    }

    private static InetAddress literal(String address) {
        try {
            // 字面量地址不会触发DNS查询
            return InetAddress.getByName(address);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("无法解析地址字面量: " + address, e);
        }
    }
}

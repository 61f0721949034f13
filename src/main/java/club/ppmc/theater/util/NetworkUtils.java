/**
 * NetworkUtils.java
 *
 * 网络相关的静态工具方法：IP 地址校验、URL 中 IPv6 地址的方括号处理、
 * "host:port" 解析、本机地址探测、主机名解析，以及信令和 SRT 地址的拼接。
 */
package club.ppmc.theater.util;

import java.net.DatagramSocket;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class NetworkUtils {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkUtils.class);

    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:.]+$");

    // 用于探测出口地址的公共 DNS，UDP connect 不会真正发包
    private static final String PROBE_IPV6 = "2001:4860:4860::8888";
    private static final String PROBE_IPV4 = "8.8.8.8";

    public static final String LOOPBACK_IPV4 = "127.0.0.1";

    private NetworkUtils() {}

    /** "host:port" 解析的结果，没有端口时 port 为空。 */
    public record HostAndPort(String host, Optional<Integer> port) {}

    public static boolean isValidIpv4(String ip) {
        return ip != null && IPV4.matcher(ip).matches();
    }

    /**
     * 校验 IPv6 地址，允许带有 "%scope" 范围标识。
     */
    public static boolean isValidIpv6(String ip) {
        if (ip == null || ip.isEmpty()) {
            return false;
        }
        String bare = stripScope(stripBrackets(ip));
        if (!bare.contains(":") || !IPV6_CHARS.matcher(bare).matches()) {
            return false;
        }
        try {
            // 只含十六进制、冒号和点的字面量不会触发DNS查询
            InetAddress.getByName(bare);
            return true;
        } catch (UnknownHostException e) {
            return false;
        }
    }

    public static boolean isValidIp(String ip) {
        return isValidIpv4(ip) || isValidIpv6(ip);
    }

    /**
     * 在 URL 中使用的主机部分：IPv6 地址加方括号，其余原样返回。
     */
    public static String formatForUrl(String host) {
        if (isValidIpv6(host)) {
            return "[" + stripBrackets(host) + "]";
        }
        return host;
    }

    /**
     * 解析 "host:port"、"[v6]:port"、纯 IPv6 地址或纯主机名。
     */
    public static HostAndPort parseAddress(String address) {
        String text = address == null ? "" : address.trim();
        if (text.startsWith("[")) {
            int end = text.indexOf(']');
            if (end > 0) {
                String host = text.substring(1, end);
                if (end + 1 < text.length() && text.charAt(end + 1) == ':') {
                    Optional<Integer> port = parsePort(text.substring(end + 2));
                    if (port.isPresent()) {
                        return new HostAndPort(host, port);
                    }
                }
                return new HostAndPort(host, Optional.empty());
            }
        }
        // 未加括号的 IPv6 地址里的冒号不是端口分隔符
        if (isValidIpv6(text)) {
            return new HostAndPort(text, Optional.empty());
        }
        int colon = text.lastIndexOf(':');
        if (colon > 0) {
            Optional<Integer> port = parsePort(text.substring(colon + 1));
            if (port.isPresent()) {
                return new HostAndPort(text.substring(0, colon), port);
            }
        }
        return new HostAndPort(text, Optional.empty());
    }

    /** 通配地址（"0.0.0.0"、"::"）或空字符串。 */
    public static boolean isWildcard(String host) {
        if (host == null || host.isBlank()) {
            return true;
        }
        String bare = stripBrackets(host.trim());
        return "0.0.0.0".equals(bare) || "::".equals(bare) || "0:0:0:0:0:0:0:0".equals(bare);
    }

    /**
     * 探测本机对外可用的地址。
     * 优先 IPv6 时，先尝试公网 IPv6 出口地址，再依次回退到网卡上的 IPv6、IPv4 地址，最后是回环地址。
     *
     * @param preferIpv6 是否优先返回 IPv6 地址。
     */
    public static String getLocalIp(boolean preferIpv6) {
        if (preferIpv6) {
            Optional<String> publicV6 = outboundAddress(PROBE_IPV6)
                    .filter(a -> a instanceof Inet6Address)
                    .filter(a -> !a.isLinkLocalAddress() && !a.isSiteLocalAddress() && !isUniqueLocal(a))
                    .map(NetworkUtils::hostAddress);
            if (publicV6.isPresent()) {
                return publicV6.get();
            }
        }

        List<String> v6 = new ArrayList<>();
        List<String> v4 = new ArrayList<>();
        for (InetAddress address : interfaceAddresses()) {
            if (address.isLoopbackAddress() || address.isLinkLocalAddress()) {
                continue;
            }
            if (address instanceof Inet6Address) {
                v6.add(hostAddress(address));
            } else if (address instanceof Inet4Address) {
                v4.add(address.getHostAddress());
            }
        }
        if (preferIpv6 && !v6.isEmpty()) {
            return v6.get(0);
        }
        if (!v4.isEmpty()) {
            return v4.get(0);
        }
        if (!v6.isEmpty()) {
            return v6.get(0);
        }
        return outboundAddress(PROBE_IPV4).map(InetAddress::getHostAddress).orElse(LOOPBACK_IPV4);
    }

    /**
     * 解析主机名，按偏好返回 IPv6 或 IPv4 地址。
     */
    public static Optional<String> resolveHostname(String hostname, boolean preferIpv6) {
        try {
            InetAddress[] all = InetAddress.getAllByName(stripBrackets(hostname));
            InetAddress firstV4 = null;
            InetAddress firstV6 = null;
            for (InetAddress address : all) {
                if (address instanceof Inet6Address && firstV6 == null) {
                    firstV6 = address;
                } else if (address instanceof Inet4Address && firstV4 == null) {
                    firstV4 = address;
                }
            }
            InetAddress chosen = preferIpv6
                    ? (firstV6 != null ? firstV6 : firstV4)
                    : (firstV4 != null ? firstV4 : firstV6);
            return Optional.ofNullable(chosen).map(NetworkUtils::hostAddress);
        } catch (UnknownHostException e) {
            LOGGER.error("解析主机名 {} 失败: {}", hostname, e.getMessage());
            return Optional.empty();
        }
    }

    /** 信令服务的地址，例如 ws://[::1]:10086/。 */
    public static URI webSocketUri(String host, int port) {
        return URI.create("ws://" + formatForUrl(host) + ":" + port + "/");
    }

    /**
     * SRT 地址。
     *
     * @param mode    "listener" 或 "caller"。
     * @param latency 延迟，单位毫秒。
     */
    public static String srtUrl(String host, int port, String mode, int latency) {
        return "srt://" + formatForUrl(host) + ":" + port + "?mode=" + mode + "&latency=" + latency;
    }

    private static Optional<Integer> parsePort(String text) {
        try {
            int port = Integer.parseInt(text);
            return port >= 0 && port <= 65535 ? Optional.of(port) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<InetAddress> outboundAddress(String probeTarget) {
        try (var socket = new DatagramSocket()) {
            socket.connect(new InetSocketAddress(InetAddress.getByName(probeTarget), 80));
            InetAddress local = socket.getLocalAddress();
            if (local == null || local.isAnyLocalAddress()) {
                return Optional.empty();
            }
            return Optional.of(local);
        } catch (Exception e) {
            LOGGER.debug("通过 {} 探测出口地址失败: {}", probeTarget, e.getMessage());
            return Optional.empty();
        }
    }

    private static List<InetAddress> interfaceAddresses() {
        List<InetAddress> result = new ArrayList<>();
        try {
            for (NetworkInterface nif : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                try {
                    if (!nif.isUp()) {
                        continue;
                    }
                } catch (SocketException e) {
                    LOGGER.debug("读取网卡 {} 状态失败: {}", nif.getName(), e.getMessage());
                    continue;
                }
                result.addAll(Collections.list(nif.getInetAddresses()));
            }
        } catch (SocketException e) {
            LOGGER.error("获取网络接口失败: {}", e.getMessage());
        }
        return result;
    }

    private static boolean isUniqueLocal(InetAddress address) {
        // fc00::/7
        return (address.getAddress()[0] & 0xfe) == 0xfc;
    }

    private static String hostAddress(InetAddress address) {
        return stripScope(address.getHostAddress());
    }

    private static String stripBrackets(String host) {
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    private static String stripScope(String ip) {
        int percent = ip.indexOf('%');
        return percent >= 0 ? ip.substring(0, percent) : ip;
    }
}

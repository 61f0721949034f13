/**
 * ProcessInfo.java
 *
 * 一个被监管进程的快照，供 /api/processes 接口返回。
 * 操作系统层面的数据由 OSHI 采集，进程已退出时这些字段为空。
 */
package club.ppmc.theater.model;

import java.time.Instant;

/**
 * @param name          逻辑名称。
 * @param pid           进程ID，未运行时为 -1。
 * @param running       是否仍在运行。
 * @param restartOnExit 退出后是否自动重启。
 * @param startTime     最近一次启动时间。
 * @param uptimeSeconds 最近一次启动至今的秒数。
 * @param osName        操作系统报告的进程名。
 * @param osState       操作系统报告的进程状态。
 * @param cpuLoad       累计CPU占用 (0.0 ~ 1.0 * 核数)。
 * @param residentBytes 常驻内存字节数。
 * @param threadCount   线程数。
 * @param stats         最近一次解析到的流统计信息，可能为 null。
 */
public record ProcessInfo(
        String name,
        long pid,
        boolean running,
        boolean restartOnExit,
        Instant startTime,
        long uptimeSeconds,
        String osName,
        String osState,
        Double cpuLoad,
        Long residentBytes,
        Integer threadCount,
        StreamStats stats
) {}

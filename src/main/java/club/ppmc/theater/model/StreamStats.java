/**
 * StreamStats.java
 *
 * 从 ffmpeg 的 -stats 输出中解析出的最近一次统计信息。
 */
package club.ppmc.theater.model;

/**
 * @param fps     当前帧率，未知时为 null。
 * @param bitrate 码率原文，例如 "2500.3kbits/s"。
 * @param time    已处理的媒体时长原文，例如 "00:01:02.03"。
 */
public record StreamStats(Double fps, String bitrate, String time) {}

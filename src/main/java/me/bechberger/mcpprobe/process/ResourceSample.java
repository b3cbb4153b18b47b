package me.bechberger.mcpprobe.process;

/**
 * Point-in-time resource usage of a server process.
 *
 * @param memoryMb   resident set size in megabytes
 * @param cpuPercent CPU time consumed since process start relative to wall clock, in percent
 */
public record ResourceSample(double memoryMb, double cpuPercent) {
}

package me.bechberger.mcpprobe.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Aggregate of one load level: {@code concurrentUsers} users each sending {@code requestsPerUser} requests.
 *
 * @param throughput successful requests per second over the level's wall clock
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoadTestResult(
        int concurrentUsers,
        int requestsPerUser,
        int totalRequests,
        int successfulRequests,
        int failedRequests,
        double errorRate,
        double throughput,
        double avgResponseTimeMs,
        double maxResponseTimeMs,
        @Nullable Double memoryBeforeMb,
        @Nullable Double memoryAfterMb,
        @Nullable Double cpuBeforePercent,
        @Nullable Double cpuAfterPercent,
        double durationSeconds,
        List<String> errors
) {

    public LoadTestResult {
        errors = List.copyOf(errors);
    }
}

package me.bechberger.mcpprobe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Latency and throughput of repeating one operation.
 * Response times are in milliseconds; memory and CPU are null when they could not be sampled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PerformanceBenchmark(
        String operation,
        int totalRequests,
        int successfulRequests,
        int failedRequests,
        double minResponseTimeMs,
        double avgResponseTimeMs,
        double maxResponseTimeMs,
        double p95ResponseTimeMs,
        double requestsPerSecond,
        double errorRate,
        @Nullable Double memoryMb,
        @Nullable Double cpuPercent,
        List<String> errors
) {

    public PerformanceBenchmark {
        errors = List.copyOf(errors);
    }

    /**
     * A benchmark that could not run at all
     */
    public static PerformanceBenchmark failed(String operation, String error) {
        return new PerformanceBenchmark(operation, 0, 0, 0, 0, 0, 0, 0, 0, 0, null, null, List.of(error));
    }

    /**
     * Whether the requests could be issued, regardless of how many failed
     */
    @JsonIgnore
    public boolean completed() {
        return errors.isEmpty();
    }
}

package me.bechberger.mcpprobe.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import me.bechberger.mcpprobe.security.SecurityScanResult;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Basic validation plus benchmarks, integration and load tests and the security scan.
 *
 * @param loadResults   keyed {@code users_<N>} in the order the levels ran
 * @param security      null when the scan was not requested
 * @param skippedReason why the process-based sections did not all run, null if they did
 * @param errors        sections that crashed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComprehensiveTestReport(
        String projectPath,
        Instant timestamp,
        boolean overallSuccess,
        ValidationReport validation,
        List<PerformanceBenchmark> benchmarks,
        List<IntegrationTestResult> integrationResults,
        Map<String, LoadTestResult> loadResults,
        @Nullable SecurityScanResult security,
        @Nullable String skippedReason,
        List<String> recommendations,
        List<String> errors,
        double totalSeconds
) implements Report {

    public ComprehensiveTestReport {
        benchmarks = List.copyOf(benchmarks);
        integrationResults = List.copyOf(integrationResults);
        loadResults = OrderedMaps.copyOf(loadResults);
        recommendations = List.copyOf(recommendations);
        errors = List.copyOf(errors);
    }

    @Override
    public boolean isSuccessful() {
        return overallSuccess;
    }

    @Override
    public String getSummary() {
        if (overallSuccess) {
            return "All tests passed";
        }
        if (!validation.overallSuccess()) {
            return "Basic validation failed";
        }
        return "Comprehensive testing found problems (" + recommendations.size() + " recommendations)";
    }
}

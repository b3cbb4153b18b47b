package me.bechberger.mcpprobe.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of validating one server project.
 * {@code overallSuccess} is true exactly when all three phase results succeeded.
 */
public record ValidationReport(
        String projectPath,
        ValidationLevel level,
        boolean overallSuccess,
        ServerStartupResult startup,
        ProtocolComplianceResult protocol,
        FunctionalityTestResult functionality,
        Map<String, Double> performanceMetrics,
        List<String> recommendations,
        Instant timestamp,
        double totalSeconds
) implements Report {

    public ValidationReport {
        performanceMetrics = OrderedMaps.copyOf(performanceMetrics);
        recommendations = List.copyOf(recommendations);
    }

    @Override
    public boolean isSuccessful() {
        return overallSuccess;
    }

    @Override
    public String getSummary() {
        if (overallSuccess) {
            return "Validation passed (" + level.name().toLowerCase() + ")";
        }
        if (!startup.success()) {
            return "Validation failed: server did not start";
        }
        if (!protocol.success()) {
            return "Validation failed: protocol compliance";
        }
        return "Validation failed: functionality";
    }
}

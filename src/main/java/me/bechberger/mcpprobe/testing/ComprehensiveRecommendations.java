package me.bechberger.mcpprobe.testing;

import me.bechberger.mcpprobe.model.IntegrationTestResult;
import me.bechberger.mcpprobe.model.LoadTestResult;
import me.bechberger.mcpprobe.model.PerformanceBenchmark;
import me.bechberger.mcpprobe.model.ValidationReport;
import me.bechberger.mcpprobe.security.IssueSeverity;
import me.bechberger.mcpprobe.security.SecurityIssue;
import me.bechberger.mcpprobe.security.SecurityScanResult;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merges the recommendations of all sections into one ordered list without duplicates.
 */
public final class ComprehensiveRecommendations {

    private ComprehensiveRecommendations() {
    }

    public static List<String> merge(ValidationReport validation, List<PerformanceBenchmark> benchmarks,
                                     List<IntegrationTestResult> integration, Map<String, LoadTestResult> load,
                                     @Nullable SecurityScanResult security, boolean sectionsRan, TestOptions options) {
        Set<String> merged = new LinkedHashSet<>(validation.recommendations());

        if (sectionsRan) {
            addBenchmarkRecommendations(merged, benchmarks, options);
            addIntegrationRecommendations(merged, integration, options);
            addLoadRecommendations(merged, load, options);
        }
        if (security != null) {
            addSecurityRecommendations(merged, security);
        }
        if (!validation.overallSuccess()) {
            merged.add("Complete basic server validation before advanced testing");
        }
        return new ArrayList<>(merged);
    }

    private static void addBenchmarkRecommendations(Set<String> merged, List<PerformanceBenchmark> benchmarks,
                                                    TestOptions options) {
        if (benchmarks.isEmpty()) {
            if (options.isIncludePerformance()) {
                merged.add("Add performance monitoring to track server metrics");
            }
            return;
        }
        addJoined(merged, "Fix failing benchmark operations: ",
                benchmarks.stream().filter(b -> !b.completed()).map(PerformanceBenchmark::operation).collect(Collectors.toList()));
        addJoined(merged, "Optimize slow operations: ",
                benchmarks.stream().filter(b -> b.avgResponseTimeMs() > options.getSlowOperationMs())
                        .map(PerformanceBenchmark::operation).collect(Collectors.toList()));
        addJoined(merged, "Fix high error rate operations: ",
                benchmarks.stream().filter(b -> b.errorRate() > options.getWarnErrorRate())
                        .map(PerformanceBenchmark::operation).collect(Collectors.toList()));
        if (benchmarks.stream().anyMatch(b -> b.memoryMb() != null && b.memoryMb() > options.getHighMemoryMb())) {
            merged.add("Consider memory optimization for resource-intensive operations");
        }
    }

    private static void addIntegrationRecommendations(Set<String> merged, List<IntegrationTestResult> integration,
                                                      TestOptions options) {
        if (integration.isEmpty()) {
            if (options.isIncludeIntegration()) {
                merged.add("Test integration with different MCP client types");
            }
            return;
        }
        addJoined(merged, "Improve compatibility with: ",
                integration.stream().filter(r -> r.compatibilityScore() < options.getMinCompatibilityScore())
                        .map(IntegrationTestResult::clientName).collect(Collectors.toList()));
    }

    private static void addLoadRecommendations(Set<String> merged, Map<String, LoadTestResult> load, TestOptions options) {
        if (load.isEmpty()) {
            return;
        }
        LoadTestResult highest = null;
        int sustained = 0;
        for (LoadTestResult result : load.values()) {
            if (highest == null || result.concurrentUsers() > highest.concurrentUsers()) {
                highest = result;
            }
            if (result.errorRate() <= options.getMaxErrorRate()) {
                sustained = Math.max(sustained, result.concurrentUsers());
            }
        }
        if (highest.errorRate() > options.getWarnErrorRate()) {
            merged.add("URGENT: Improve server stability under load");
        }
        if (sustained < options.getMinConcurrentUsers()) {
            merged.add("Consider scaling improvements for concurrent user support");
        }
    }

    private static void addSecurityRecommendations(Set<String> merged, SecurityScanResult security) {
        if (security.criticalCount() > 0) {
            merged.add("URGENT: Fix critical security vulnerabilities before deployment");
        }
        if (security.highCount() > 0) {
            merged.add("Address high-severity security issues");
        }
        for (SecurityIssue issue : security.issues()) {
            if (issue.severity().isAtLeast(IssueSeverity.HIGH)) {
                merged.add("[" + issue.severity().name() + "] " + issue.description() + " (" + issue.location() + ")");
            }
        }
        merged.addAll(security.recommendations());
    }

    private static void addJoined(Set<String> merged, String prefix, List<String> names) {
        if (!names.isEmpty()) {
            merged.add(prefix + String.join(", ", names));
        }
    }
}

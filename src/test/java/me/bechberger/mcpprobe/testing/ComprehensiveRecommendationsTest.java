package me.bechberger.mcpprobe.testing;

import me.bechberger.mcpprobe.model.FunctionalityTestResult;
import me.bechberger.mcpprobe.model.IntegrationTestResult;
import me.bechberger.mcpprobe.model.LoadTestResult;
import me.bechberger.mcpprobe.model.PerformanceBenchmark;
import me.bechberger.mcpprobe.model.ProtocolComplianceResult;
import me.bechberger.mcpprobe.model.ServerStartupResult;
import me.bechberger.mcpprobe.model.ValidationLevel;
import me.bechberger.mcpprobe.model.ValidationReport;
import me.bechberger.mcpprobe.security.IssueSeverity;
import me.bechberger.mcpprobe.security.ScanCategory;
import me.bechberger.mcpprobe.security.SecurityIssue;
import me.bechberger.mcpprobe.security.SecurityScanResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ComprehensiveRecommendationsTest {

    private static final TestOptions OPTIONS = TestOptions.defaults();

    static ValidationReport validation(boolean success, List<String> recommendations) {
        return new ValidationReport("/p", ValidationLevel.STANDARD, success,
                new ServerStartupResult(success, 1L, 0.2, List.of(), List.of(), "node index.js"),
                new ProtocolComplianceResult(true, List.of("initialize"), List.of(), "2024-11-05", "s", "1", List.of()),
                FunctionalityTestResult.notExecuted(), Map.of(), recommendations, Instant.EPOCH, 1.0);
    }

    private static PerformanceBenchmark benchmark(String name, double avgMs, double errorRate, Double memoryMb) {
        return new PerformanceBenchmark(name, 10, 10, 0, 1, avgMs, avgMs, avgMs, 5, errorRate, memoryMb, null, List.of());
    }

    private static LoadTestResult load(int users, double errorRate) {
        return new LoadTestResult(users, 10, users * 10, users * 10, 0, errorRate, 10, 1, 2,
                null, null, null, null, 1, List.of());
    }

    @Test
    void sectionsAreMergedInOrderWithoutDuplicates() {
        Map<String, LoadTestResult> loads = new LinkedHashMap<>();
        loads.put("users_1", load(1, 0.0));
        loads.put("users_5", load(5, 0.5));
        SecurityScanResult security = new SecurityScanResult("/p", Map.of(),
                List.of(new SecurityIssue("hardcoded_secret", ScanCategory.CODE, "server.py", 3,
                        "Hardcoded password", IssueSeverity.CRITICAL)),
                1, List.of(), List.of("Use environment variables for secrets"), 0.1);

        List<String> merged = ComprehensiveRecommendations.merge(
                validation(true, List.of("Consider optimizing server startup time")),
                List.of(benchmark("call_tool", 2500, 0.0, 150.0), benchmark("list_tools", 5, 0.2, null),
                        PerformanceBenchmark.failed("get_prompt", "boom")),
                List.of(new IntegrationTestResult("Legacy Client", true, 1, List.of(), List.of("tools"), 0.5, List.of())),
                loads, security, true, OPTIONS);

        assertEquals(List.of(
                "Consider optimizing server startup time",
                "Fix failing benchmark operations: get_prompt",
                "Optimize slow operations: call_tool",
                "Fix high error rate operations: list_tools",
                "Consider memory optimization for resource-intensive operations",
                "Improve compatibility with: Legacy Client",
                "URGENT: Improve server stability under load",
                "Consider scaling improvements for concurrent user support",
                "URGENT: Fix critical security vulnerabilities before deployment",
                "[CRITICAL] Hardcoded password (server.py:3)",
                "Use environment variables for secrets"), merged);
        assertEquals(merged.size(), new HashSet<>(merged).size());
    }

    @Test
    void emptySectionsAskForCoverage() {
        List<String> merged = ComprehensiveRecommendations.merge(validation(true, List.of()), List.of(), List.of(),
                Map.of(), null, true, OPTIONS);

        assertEquals(List.of("Add performance monitoring to track server metrics",
                "Test integration with different MCP client types"), merged);
    }

    @Test
    void excludedSectionsStayQuiet() {
        TestOptions options = TestOptions.builder().includePerformance(false).includeIntegration(false).build();

        assertEquals(List.of(), ComprehensiveRecommendations.merge(validation(true, List.of()), List.of(), List.of(),
                Map.of(), null, true, options));
    }

    @Test
    void failedValidationAddsGateRecommendation() {
        List<String> merged = ComprehensiveRecommendations.merge(
                validation(false, List.of("Fix server startup issues before deployment")),
                List.of(), List.of(), Map.of(), null, false, OPTIONS);

        assertEquals(List.of("Fix server startup issues before deployment",
                "Complete basic server validation before advanced testing"), merged);
    }

    @Test
    void healthyLoadAboveMinimumGivesNoLoadRecommendation() {
        Map<String, LoadTestResult> loads = new LinkedHashMap<>();
        loads.put("users_10", load(10, 0.0));
        loads.put("users_20", load(20, 0.01));

        List<String> merged = ComprehensiveRecommendations.merge(validation(true, List.of()),
                List.of(benchmark("ping", 1, 0, null)), List.of(), loads, null, true,
                TestOptions.builder().includeIntegration(false).build());

        assertEquals(List.of(), merged);
    }
}

package me.bechberger.mcpprobe.test;

import me.bechberger.mcpprobe.model.ComprehensiveTestReport;
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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed reports for rendering tests.
 */
public final class SampleReports {

    public static final Instant TIMESTAMP = Instant.parse("2024-11-05T10:15:30Z");

    private SampleReports() {
    }

    public static ValidationReport passedValidation() {
        Map<String, Boolean> tools = new LinkedHashMap<>();
        tools.put("echo", true);
        tools.put("add", true);
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("startup_time_seconds", 0.42);
        metrics.put("tools_count", 2.0);
        return new ValidationReport("/srv/weather", ValidationLevel.STANDARD, true,
                new ServerStartupResult(true, 4242L, 0.42, List.of(), List.of("listening on stdio"), "node index.js"),
                new ProtocolComplianceResult(true, List.of("initialize", "tools/list"), List.of(), "2024-11-05",
                        "weather", "1.0.0", List.of()),
                new FunctionalityTestResult(true, true, tools, Map.of(), Map.of(), List.of(), Map.of("tools_count", 2.0)),
                metrics, List.of(), TIMESTAMP, 1.25);
    }

    public static ValidationReport failedValidation() {
        return new ValidationReport("/srv/broken", ValidationLevel.STANDARD, false,
                new ServerStartupResult(true, 17L, 0.3, List.of(), List.of(), "python server.py"),
                new ProtocolComplianceResult(false, List.of("initialize"), List.of("tools/list", "prompts/list"),
                        "2024-11-05", "broken", "0.1", List.of()),
                FunctionalityTestResult.skipped("Skipped: protocol compliance failed"),
                Map.of(), List.of("Implement missing MCP capabilities: tools/list, prompts/list"), TIMESTAMP, 0.9);
    }

    public static SecurityScanResult securityResult() {
        List<SecurityIssue> issues = List.of(
                new SecurityIssue("hardcoded_secret", ScanCategory.CODE, "server.py", 3,
                        "Possible hard-coded credential", IssueSeverity.MEDIUM),
                new SecurityIssue("code_injection", ScanCategory.CODE, "server.py", 9,
                        "Use of eval() can execute arbitrary code", IssueSeverity.CRITICAL));
        return new SecurityScanResult("/srv/weather", Map.of(ScanCategory.CODE,
                Map.of(IssueSeverity.CRITICAL, 1, IssueSeverity.MEDIUM, 1)), issues, 4, List.of(),
                List.of("Fix critical security vulnerabilities immediately"), 0.05);
    }

    public static ComprehensiveTestReport comprehensive() {
        Map<String, LoadTestResult> load = new LinkedHashMap<>();
        load.put("users_1", new LoadTestResult(1, 10, 10, 10, 0, 0.0, 250.0, 4.0, 6.0,
                80.0, 81.0, 1.0, 2.0, 0.04, List.of()));
        load.put("users_5", new LoadTestResult(5, 10, 50, 40, 10, 0.2, 300.0, 15.0, 40.0,
                81.0, 84.0, 2.0, 9.0, 0.13, List.of("User 3: tools/list timeout")));
        return new ComprehensiveTestReport("/srv/weather", TIMESTAMP, false, passedValidation(),
                List.of(new PerformanceBenchmark("list_tools", 100, 100, 0, 1.0, 2.0, 5.0, 3.0, 480.0, 0.0,
                        85.5, 3.2, List.of())),
                List.of(new IntegrationTestResult("Legacy Client", true, 12.0, List.of("tools"),
                        List.of("resources", "tool_execution", "resource_access"), 0.25, List.of("resources/list failed"))),
                load, securityResult(), null,
                List.of("URGENT: Improve server stability under load", "Improve compatibility with: Legacy Client"),
                List.of(), 12.5);
    }
}

package me.bechberger.mcpprobe.view.views;

import me.bechberger.mcpprobe.model.ComprehensiveTestReport;
import me.bechberger.mcpprobe.model.IntegrationTestResult;
import me.bechberger.mcpprobe.model.LoadTestResult;
import me.bechberger.mcpprobe.model.PerformanceBenchmark;
import me.bechberger.mcpprobe.view.HandlebarsViewRenderer;
import me.bechberger.mcpprobe.view.OutputOptions;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validation, benchmark, integration, load and security sections of a comprehensive run.
 */
public class ComprehensiveReportView extends HandlebarsViewRenderer<ComprehensiveTestReport> {

    public ComprehensiveReportView() {
        super("comprehensive", "comprehensive", ComprehensiveTestReport.class);
    }

    @Override
    protected Map<String, Object> buildContext(@NotNull ComprehensiveTestReport report, @NotNull OutputOptions options) {
        Map<String, Object> context = super.buildContext(report, options);
        context.put("projectPath", report.projectPath());
        context.put("timestamp", report.timestamp().toString());
        context.put("totalSeconds", report.totalSeconds());
        context.put("validation", ValidationReportView.validationSection(report.validation()));
        context.put("skippedReason", report.skippedReason());

        List<Map<String, Object>> benchmarks = new ArrayList<>();
        for (PerformanceBenchmark b : report.benchmarks()) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("operation", b.operation());
            map.put("completed", b.completed() && b.failedRequests() == 0);
            map.put("total", b.totalRequests());
            map.put("successful", b.successfulRequests());
            map.put("avg", b.avgResponseTimeMs());
            map.put("p95", b.p95ResponseTimeMs());
            map.put("max", b.maxResponseTimeMs());
            map.put("rps", b.requestsPerSecond());
            map.put("errorRate", b.errorRate());
            map.put("memoryMb", b.memoryMb());
            map.put("errors", b.errors());
            benchmarks.add(map);
        }
        context.put("benchmarks", benchmarks);
        context.put("hasBenchmarks", !benchmarks.isEmpty());

        List<Map<String, Object>> integration = new ArrayList<>();
        for (IntegrationTestResult r : report.integrationResults()) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("client", r.clientName());
            map.put("connected", r.connectionSuccessful());
            map.put("score", r.compatibilityScore());
            map.put("handshakeMs", r.handshakeTimeMs());
            map.put("supported", String.join(", ", r.supportedFeatures()));
            map.put("failed", String.join(", ", r.failedFeatures()));
            map.put("hasFailed", !r.failedFeatures().isEmpty());
            map.put("errors", r.errors());
            integration.add(map);
        }
        context.put("integration", integration);
        context.put("hasIntegration", !integration.isEmpty());

        List<Map<String, Object>> load = new ArrayList<>();
        for (LoadTestResult r : report.loadResults().values()) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("users", r.concurrentUsers());
            map.put("total", r.totalRequests());
            map.put("successful", r.successfulRequests());
            map.put("errorRate", r.errorRate());
            map.put("throughput", r.throughput());
            map.put("avg", r.avgResponseTimeMs());
            map.put("max", r.maxResponseTimeMs());
            map.put("durationSeconds", r.durationSeconds());
            map.put("errors", r.errors());
            load.add(map);
        }
        context.put("load", load);
        context.put("hasLoad", !load.isEmpty());

        if (report.security() != null) {
            context.put("security", SecurityScanView.securitySection(report.security()));
        }
        context.put("errors", report.errors());
        context.put("recommendations", report.recommendations());
        context.put("hasRecommendations", !report.recommendations().isEmpty());
        return context;
    }
}

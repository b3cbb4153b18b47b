package me.bechberger.mcpprobe.view.views;

import me.bechberger.mcpprobe.model.FunctionalityTestResult;
import me.bechberger.mcpprobe.model.ProtocolComplianceResult;
import me.bechberger.mcpprobe.model.ServerStartupResult;
import me.bechberger.mcpprobe.model.ValidationReport;
import me.bechberger.mcpprobe.view.HandlebarsViewRenderer;
import me.bechberger.mcpprobe.view.OutputOptions;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Startup, protocol and functionality results of one validation run.
 */
public class ValidationReportView extends HandlebarsViewRenderer<ValidationReport> {

    public ValidationReportView() {
        super("validation", "validation", ValidationReport.class);
    }

    @Override
    protected Map<String, Object> buildContext(@NotNull ValidationReport report, @NotNull OutputOptions options) {
        Map<String, Object> context = super.buildContext(report, options);
        context.put("validation", validationSection(report));
        context.put("recommendations", report.recommendations());
        context.put("hasRecommendations", !report.recommendations().isEmpty());
        return context;
    }

    /**
     * Template data for the validation part, shared with the comprehensive report
     */
    static Map<String, Object> validationSection(ValidationReport report) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("projectPath", report.projectPath());
        section.put("level", report.level().name().toLowerCase());
        section.put("timestamp", report.timestamp().toString());
        section.put("totalSeconds", report.totalSeconds());
        section.put("overallSuccess", report.overallSuccess());
        section.put("startup", startup(report.startup()));
        section.put("protocol", protocol(report.protocol()));
        section.put("functionality", functionality(report.functionality()));

        List<Map<String, Object>> metrics = new ArrayList<>();
        report.performanceMetrics().forEach((name, value) -> metrics.add(Map.of("name", name, "value", value)));
        section.put("metrics", metrics);
        return section;
    }

    private static Map<String, Object> startup(ServerStartupResult startup) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", startup.success());
        map.put("pid", startup.pid());
        map.put("entryCommand", startup.entryCommand());
        map.put("startupTimeSeconds", startup.startupTimeSeconds());
        map.put("errors", startup.errors());
        map.put("logs", startup.logs());
        map.put("hasLogs", !startup.logs().isEmpty());
        return map;
    }

    private static Map<String, Object> protocol(ProtocolComplianceResult protocol) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", protocol.success());
        map.put("protocolVersion", protocol.protocolVersion());
        map.put("serverName", protocol.serverName());
        map.put("serverVersion", protocol.serverVersion());
        map.put("supported", String.join(", ", protocol.supportedCapabilities()));
        map.put("missing", String.join(", ", protocol.missingCapabilities()));
        map.put("hasMissing", !protocol.missingCapabilities().isEmpty());
        map.put("errors", protocol.errors());
        return map;
    }

    private static Map<String, Object> functionality(FunctionalityTestResult functionality) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", functionality.success());
        map.put("executed", functionality.executed());
        List<Map<String, Object>> items = new ArrayList<>();
        addItems(items, "tool", functionality.tools());
        addItems(items, "resource", functionality.resources());
        addItems(items, "prompt", functionality.prompts());
        map.put("items", items);
        map.put("itemsTested", functionality.itemsTested());
        map.put("errors", functionality.errors());
        return map;
    }

    private static void addItems(List<Map<String, Object>> items, String kind, Map<String, Boolean> outcomes) {
        outcomes.forEach((name, passed) -> items.add(Map.of("kind", kind, "name", name, "passed", passed)));
    }
}

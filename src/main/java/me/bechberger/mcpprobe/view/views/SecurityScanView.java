package me.bechberger.mcpprobe.view.views;

import me.bechberger.mcpprobe.security.IssueSeverity;
import me.bechberger.mcpprobe.security.SecurityIssue;
import me.bechberger.mcpprobe.security.SecurityScanResult;
import me.bechberger.mcpprobe.view.HandlebarsViewRenderer;
import me.bechberger.mcpprobe.view.OutputOptions;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Security findings, most severe first.
 */
public class SecurityScanView extends HandlebarsViewRenderer<SecurityScanResult> {

    public SecurityScanView() {
        super("security", "security", SecurityScanResult.class);
    }

    @Override
    protected Map<String, Object> buildContext(@NotNull SecurityScanResult result, @NotNull OutputOptions options) {
        Map<String, Object> context = super.buildContext(result, options);
        context.put("security", securitySection(result));
        return context;
    }

    static Map<String, Object> securitySection(SecurityScanResult result) {
        Map<String, Object> section = new LinkedHashMap<>();
        section.put("projectPath", result.projectPath());
        section.put("scannedFiles", result.scannedFiles());
        section.put("durationSeconds", result.durationSeconds());
        section.put("issueCount", result.issues().size());
        section.put("hasIssues", !result.issues().isEmpty());

        List<Map<String, Object>> severities = new ArrayList<>();
        for (IssueSeverity severity : IssueSeverity.values()) {
            severities.add(Map.of("severity", severity, "count", result.count(severity)));
        }
        section.put("severities", severities);

        List<Map<String, Object>> issues = new ArrayList<>();
        for (IssueSeverity severity : IssueSeverity.values()) {
            for (SecurityIssue issue : result.issues()) {
                if (issue.severity() == severity) {
                    Map<String, Object> map = new LinkedHashMap<>();
                    map.put("severity", issue.severity());
                    map.put("category", issue.category().name().toLowerCase());
                    map.put("type", issue.type());
                    map.put("location", issue.location());
                    map.put("description", issue.description());
                    issues.add(map);
                }
            }
        }
        section.put("issues", issues);
        section.put("warnings", result.warnings());
        section.put("recommendations", result.recommendations());
        return section;
    }
}

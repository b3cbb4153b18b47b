package me.bechberger.mcpprobe.security;

import me.bechberger.mcpprobe.model.OrderedMaps;
import me.bechberger.mcpprobe.model.Report;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Findings of all scan passes.
 *
 * @param counts   per category, the number of issues by severity (all severities present)
 * @param warnings files that could not be read
 */
public record SecurityScanResult(
        String projectPath,
        Map<ScanCategory, Map<IssueSeverity, Integer>> counts,
        List<SecurityIssue> issues,
        int scannedFiles,
        List<String> warnings,
        List<String> recommendations,
        double durationSeconds
) implements Report {

    public SecurityScanResult {
        Map<ScanCategory, Map<IssueSeverity, Integer>> copy = new EnumMap<>(ScanCategory.class);
        counts.forEach((category, bySeverity) -> copy.put(category, OrderedMaps.copyOf(bySeverity)));
        counts = OrderedMaps.copyOf(copy);
        issues = List.copyOf(issues);
        warnings = List.copyOf(warnings);
        recommendations = List.copyOf(recommendations);
    }

    /**
     * Number of issues with the given severity over all categories
     */
    public int count(IssueSeverity severity) {
        return (int) issues.stream().filter(i -> i.severity() == severity).count();
    }

    public int criticalCount() {
        return count(IssueSeverity.CRITICAL);
    }

    public int highCount() {
        return count(IssueSeverity.HIGH);
    }

    @Override
    public boolean isSuccessful() {
        return criticalCount() == 0;
    }

    @Override
    public String getSummary() {
        if (issues.isEmpty()) {
            return "No security issues found in " + scannedFiles + " files";
        }
        return issues.size() + " security issues (" + criticalCount() + " critical, " + highCount() + " high)";
    }
}

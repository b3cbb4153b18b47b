package me.bechberger.mcpprobe.validation;

import me.bechberger.mcpprobe.model.FunctionalityTestResult;
import me.bechberger.mcpprobe.model.ProtocolComplianceResult;
import me.bechberger.mcpprobe.model.ServerStartupResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives recommendations from the phase results. Same input, same list.
 */
public final class ValidationRecommendations {

    private ValidationRecommendations() {
    }

    public static List<String> generate(ServerStartupResult startup, ProtocolComplianceResult protocol,
                                        FunctionalityTestResult functionality, ValidationOptions options) {
        List<String> recommendations = new ArrayList<>();
        if (!startup.success()) {
            recommendations.add("Fix server startup issues before deployment");
            if (!startup.errors().isEmpty()) {
                recommendations.add("Review server logs for startup errors");
            }
        }
        if (!protocol.missingCapabilities().isEmpty()) {
            recommendations.add("Implement missing MCP capabilities: " + String.join(", ", protocol.missingCapabilities()));
        }
        if (functionality.executed() && functionality.itemsTested() == 0) {
            recommendations.add("Add at least one tool, resource, or prompt to make the server useful");
        }
        if (startup.success() && startup.startupTimeSeconds() > options.getSlowStartupThreshold().toMillis() / 1000.0) {
            recommendations.add("Consider optimizing server startup time");
        }
        return recommendations;
    }
}

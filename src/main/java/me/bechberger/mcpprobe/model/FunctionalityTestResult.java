package me.bechberger.mcpprobe.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of exercising the server's tools, resources and prompts.
 *
 * @param executed false when the validation level does not include this phase
 * @param tools    tool name to pass/fail, likewise for resources (by URI) and prompts
 * @param metrics  average response time per kind, in milliseconds
 */
public record FunctionalityTestResult(
        boolean success,
        boolean executed,
        Map<String, Boolean> tools,
        Map<String, Boolean> resources,
        Map<String, Boolean> prompts,
        List<String> errors,
        Map<String, Double> metrics
) implements PhaseResult {

    public FunctionalityTestResult {
        tools = OrderedMaps.copyOf(tools);
        resources = OrderedMaps.copyOf(resources);
        prompts = OrderedMaps.copyOf(prompts);
        errors = List.copyOf(errors);
        metrics = OrderedMaps.copyOf(metrics);
    }

    public static FunctionalityTestResult notExecuted() {
        return new FunctionalityTestResult(true, false, Map.of(), Map.of(), Map.of(), List.of(), Map.of());
    }

    public static FunctionalityTestResult skipped(String reason) {
        return new FunctionalityTestResult(false, false, Map.of(), Map.of(), Map.of(), List.of(reason), Map.of());
    }

    public int itemsTested() {
        return tools.size() + resources.size() + prompts.size();
    }
}

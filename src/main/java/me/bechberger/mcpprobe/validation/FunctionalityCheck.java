package me.bechberger.mcpprobe.validation;

import com.fasterxml.jackson.databind.JsonNode;
import me.bechberger.mcpprobe.model.FunctionalityTestResult;
import me.bechberger.mcpprobe.model.ValidationLevel;
import me.bechberger.mcpprobe.process.ProcessStartException;
import me.bechberger.mcpprobe.process.ServerProcess;
import me.bechberger.mcpprobe.protocol.ExchangeResult;
import me.bechberger.mcpprobe.protocol.JsonRpcRequest;
import me.bechberger.mcpprobe.protocol.McpRequests;
import me.bechberger.mcpprobe.protocol.McpResponses;
import me.bechberger.mcpprobe.protocol.McpSession;
import me.bechberger.mcpprobe.protocol.ProtocolException;
import me.bechberger.mcpprobe.protocol.ServerInfo;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists the server's tools, resources and prompts and exercises them: every tool is called with
 * synthesized arguments, every resource read and every prompt fetched. An item passes when the
 * response has the shape its method declares.
 */
public class FunctionalityCheck implements ValidationCheck<FunctionalityTestResult> {

    @Override
    public @NotNull ValidationPhase getPhase() {
        return ValidationPhase.FUNCTIONALITY;
    }

    @Override
    public @NotNull FunctionalityTestResult run(@NotNull ValidationContext context) {
        List<String> errors = new ArrayList<>();
        Map<String, Map<String, Boolean>> outcomes = new LinkedHashMap<>();
        Map<String, Double> metrics = new LinkedHashMap<>();
        for (String kind : McpRequests.LISTABLE_KINDS) {
            outcomes.put(kind, new LinkedHashMap<>());
        }

        try (ServerProcess process = context.startServer()) {
            McpSession session = context.openSession(process);
            ServerInfo info;
            try {
                info = session.initialize();
            } catch (IOException e) {
                errors.add("Initialize handshake failed: " + e.getMessage());
                return result(outcomes, errors, metrics);
            }
            int limit = context.options().getLevel().atLeast(ValidationLevel.COMPREHENSIVE)
                    ? Integer.MAX_VALUE
                    : context.options().getMaxItemsPerKind();
            for (String kind : McpRequests.LISTABLE_KINDS) {
                if (info.hasCapability(kind)) {
                    exerciseKind(session, kind, limit, outcomes.get(kind), errors, metrics);
                }
            }
        } catch (ProcessStartException e) {
            errors.add(e.getMessage());
            return result(outcomes, errors, metrics);
        }

        int tested = outcomes.values().stream().mapToInt(Map::size).sum();
        if (tested == 0 && errors.isEmpty()) {
            errors.add("Server exposes no tools, resources or prompts");
        }
        return result(outcomes, errors, metrics);
    }

    @Override
    public @NotNull FunctionalityTestResult failed(@NotNull ValidationContext context, @NotNull String reason) {
        return FunctionalityTestResult.skipped(reason);
    }

    private void exerciseKind(McpSession session, String kind, int limit, Map<String, Boolean> outcomes,
                              List<String> errors, Map<String, Double> metrics) {
        List<JsonNode> items;
        try {
            items = session.listAll(kind);
        } catch (ProtocolException e) {
            errors.add(e.getMessage());
            return;
        }
        metrics.put(kind + "_count", (double) items.size());

        double totalMs = 0;
        int calls = 0;
        for (JsonNode item : items.subList(0, Math.min(limit, items.size()))) {
            String key = itemKey(kind, item);
            if (key.isEmpty()) {
                errors.add(McpRequests.listMethod(kind) + " returned an item without "
                        + (kind.equals("resources") ? "uri" : "name"));
                continue;
            }
            JsonRpcRequest request = requestFor(session.nextId(), kind, key, item);
            ExchangeResult result = session.send(request);
            totalMs += result.elapsedMillis();
            calls++;
            try {
                McpResponses.validatePayload(request.method(), result);
                outcomes.put(key, true);
            } catch (ProtocolException e) {
                outcomes.put(key, false);
                errors.add(singular(kind) + " '" + key + "': " + e.getMessage());
            }
        }
        if (calls > 0) {
            metrics.put(kind + "_response_time_ms", totalMs / calls);
        }
    }

    public static String itemKey(String kind, JsonNode item) {
        return kind.equals("resources") ? item.path("uri").asText("") : item.path("name").asText("");
    }

    public static JsonRpcRequest requestFor(long id, String kind, String key, JsonNode item) {
        return switch (kind) {
            case "tools" -> McpRequests.callTool(id, key, ArgumentSynthesizer.forTool(item.get("inputSchema")));
            case "resources" -> McpRequests.readResource(id, key);
            case "prompts" -> McpRequests.getPrompt(id, key, ArgumentSynthesizer.forPrompt(item.get("arguments")));
            default -> throw new IllegalArgumentException("Unknown capability kind: " + kind);
        };
    }

    private static String singular(String kind) {
        return switch (kind) {
            case "tools" -> "Tool";
            case "resources" -> "Resource";
            case "prompts" -> "Prompt";
            default -> kind;
        };
    }

    private static FunctionalityTestResult result(Map<String, Map<String, Boolean>> outcomes, List<String> errors,
                                                  Map<String, Double> metrics) {
        int tested = outcomes.values().stream().mapToInt(Map::size).sum();
        return new FunctionalityTestResult(errors.isEmpty() && tested > 0, true,
                outcomes.get("tools"), outcomes.get("resources"), outcomes.get("prompts"), errors, metrics);
    }
}

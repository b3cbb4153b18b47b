package me.bechberger.mcpprobe.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;

/**
 * Checks that MCP results have the shape their method declares.
 */
public final class McpResponses {

    private McpResponses() {
    }

    /**
     * The result of a successful exchange.
     *
     * @throws ProtocolException if the exchange failed or carried an error
     */
    public static @NotNull JsonNode requireResult(@NotNull String method, @NotNull ExchangeResult result)
            throws ProtocolException {
        if (!result.isSuccess()) {
            throw new ProtocolException(method + " failed: " + result.describeFailure());
        }
        JsonNode node = result.response().result();
        if (node == null || !node.isObject()) {
            throw new ProtocolException(method + " returned no result object");
        }
        return node;
    }

    /**
     * The named array member of a result.
     */
    public static @NotNull JsonNode requireArray(@NotNull String method, @NotNull JsonNode result,
                                                 @NotNull String field) throws ProtocolException {
        JsonNode array = result.get(field);
        if (array == null || !array.isArray()) {
            throw new ProtocolException(method + " result has no '" + field + "' array");
        }
        return array;
    }

    /**
     * Member of the array each method returns: content for tool calls, contents for resource reads,
     * messages for prompts.
     */
    public static String payloadField(@NotNull String method) {
        return switch (method) {
            case McpRequests.TOOLS_CALL -> "content";
            case McpRequests.RESOURCES_READ -> "contents";
            case McpRequests.PROMPTS_GET -> "messages";
            default -> throw new IllegalArgumentException("No payload shape for " + method);
        };
    }

    /**
     * Validate a tools/call, resources/read or prompts/get exchange
     */
    public static void validatePayload(@NotNull String method, @NotNull ExchangeResult result) throws ProtocolException {
        requireArray(method, requireResult(method, result), payloadField(method));
    }
}

package me.bechberger.mcpprobe.protocol;

import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for the MCP requests the probe sends.
 */
public final class McpRequests {

    public static final String PROTOCOL_VERSION = "2024-11-05";

    public static final String INITIALIZE = "initialize";
    public static final String INITIALIZED = "notifications/initialized";
    public static final String PING = "ping";
    public static final String TOOLS_LIST = "tools/list";
    public static final String TOOLS_CALL = "tools/call";
    public static final String RESOURCES_LIST = "resources/list";
    public static final String RESOURCES_READ = "resources/read";
    public static final String PROMPTS_LIST = "prompts/list";
    public static final String PROMPTS_GET = "prompts/get";

    /** Capability kinds that come with a list method */
    public static final List<String> LISTABLE_KINDS = List.of("tools", "resources", "prompts");

    private McpRequests() {
    }

    public static JsonRpcRequest initialize(@NotNull Object id, @NotNull String protocolVersion,
                                            @NotNull String clientName, @NotNull String clientVersion,
                                            @NotNull Map<String, Object> capabilities) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("protocolVersion", protocolVersion);
        params.put("capabilities", capabilities);
        params.put("clientInfo", Map.of("name", clientName, "version", clientVersion));
        return JsonRpcRequest.request(id, INITIALIZE, params);
    }

    public static JsonRpcRequest initialized() {
        return JsonRpcRequest.notification(INITIALIZED, null);
    }

    public static JsonRpcRequest ping(@NotNull Object id) {
        return JsonRpcRequest.request(id, PING, null);
    }

    /**
     * The list request for a capability kind, e.g. {@code tools/list}
     */
    public static JsonRpcRequest list(@NotNull Object id, @NotNull String kind, String cursor) {
        Map<String, Object> params = cursor != null ? Map.of("cursor", cursor) : null;
        return JsonRpcRequest.request(id, listMethod(kind), params);
    }

    public static JsonRpcRequest callTool(@NotNull Object id, @NotNull String name, @NotNull Map<String, Object> arguments) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments);
        return JsonRpcRequest.request(id, TOOLS_CALL, params);
    }

    public static JsonRpcRequest readResource(@NotNull Object id, @NotNull String uri) {
        return JsonRpcRequest.request(id, RESOURCES_READ, Map.of("uri", uri));
    }

    public static JsonRpcRequest getPrompt(@NotNull Object id, @NotNull String name, @NotNull Map<String, Object> arguments) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments);
        return JsonRpcRequest.request(id, PROMPTS_GET, params);
    }

    public static String listMethod(@NotNull String kind) {
        return kind + "/list";
    }
}

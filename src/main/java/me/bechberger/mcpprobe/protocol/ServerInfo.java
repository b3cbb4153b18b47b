package me.bechberger.mcpprobe.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * What a server reported in its initialize result.
 *
 * @param capabilityKeys capability member names in the order the server sent them
 */
public record ServerInfo(
        @Nullable String protocolVersion,
        @Nullable String name,
        @Nullable String version,
        List<String> capabilityKeys
) {

    public ServerInfo {
        capabilityKeys = List.copyOf(capabilityKeys);
    }

    public static ServerInfo fromInitializeResult(@NotNull JsonNode result) {
        List<String> keys = new ArrayList<>();
        JsonNode capabilities = result.path("capabilities");
        if (capabilities.isObject()) {
            Iterator<String> names = capabilities.fieldNames();
            names.forEachRemaining(keys::add);
        }
        JsonNode serverInfo = result.path("serverInfo");
        return new ServerInfo(
                textOrNull(result.get("protocolVersion")),
                textOrNull(serverInfo.get("name")),
                textOrNull(serverInfo.get("version")),
                keys);
    }

    public boolean hasCapability(@NotNull String key) {
        return capabilityKeys.contains(key);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}

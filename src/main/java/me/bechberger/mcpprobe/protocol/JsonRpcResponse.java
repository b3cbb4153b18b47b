package me.bechberger.mcpprobe.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A JSON-RPC 2.0 response carrying either a result or an error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcResponse(JsonNode id, @Nullable JsonNode result, @Nullable JsonRpcError error) {

    /**
     * Build from a parsed response object.
     */
    public static JsonRpcResponse fromJson(@NotNull JsonNode node) {
        JsonRpcError error = null;
        JsonNode errorNode = node.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            error = new JsonRpcError(
                    errorNode.path("code").asInt(0),
                    errorNode.path("message").asText(""),
                    errorNode.get("data"));
        }
        return new JsonRpcResponse(node.get("id"), node.get("result"), error);
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }

    @JsonIgnore
    public boolean hasResult() {
        return result != null && !result.isNull();
    }
}

package me.bechberger.mcpprobe.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Error member of a JSON-RPC response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcError(int code, String message, JsonNode data) {

    public static final int METHOD_NOT_FOUND = -32601;

    @Override
    public String toString() {
        return message + " (code " + code + ")";
    }
}

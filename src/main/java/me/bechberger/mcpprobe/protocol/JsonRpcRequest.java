package me.bechberger.mcpprobe.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * A JSON-RPC 2.0 request, or a notification when {@code id} is null.
 *
 * @param id     caller-supplied correlation id (string or number)
 * @param params request parameters, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcRequest(
        String jsonrpc,
        @Nullable Object id,
        String method,
        @Nullable Map<String, Object> params
) {

    public static final String VERSION = "2.0";

    public static JsonRpcRequest request(@NotNull Object id, @NotNull String method, @Nullable Map<String, Object> params) {
        return new JsonRpcRequest(VERSION, id, method, params);
    }

    public static JsonRpcRequest notification(@NotNull String method, @Nullable Map<String, Object> params) {
        return new JsonRpcRequest(VERSION, null, method, params);
    }

    @JsonIgnore
    public boolean isNotification() {
        return id == null;
    }
}

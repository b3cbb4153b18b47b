package me.bechberger.mcpprobe.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import me.bechberger.mcpprobe.process.ServerProcess;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client side of one MCP conversation: handshake, listing and numbered requests.
 */
public class McpSession implements RequestChannel {

    public static final String CLIENT_NAME = "mcpprobe";
    public static final String CLIENT_VERSION = "0.1.0";

    static final int MAX_LIST_PAGES = 10;

    /**
     * Writes notifications, which get no response
     */
    @FunctionalInterface
    public interface NotificationSink {
        void notify(@NotNull JsonRpcRequest notification) throws IOException;
    }

    private final RequestChannel channel;
    private final NotificationSink notifications;
    private final AtomicLong ids = new AtomicLong(1);
    private @Nullable ServerInfo serverInfo;

    public McpSession(@NotNull RequestChannel channel, @NotNull NotificationSink notifications) {
        this.channel = channel;
        this.notifications = notifications;
    }

    /**
     * Session over a real process
     */
    public static McpSession open(@NotNull ProtocolExchange exchange, @NotNull ServerProcess process,
                                  @NotNull Duration timeout) {
        return new McpSession(exchange.channel(process, timeout), n -> exchange.notify(process, n, timeout));
    }

    @Override
    public @NotNull ExchangeResult send(@NotNull JsonRpcRequest request) {
        return channel.send(request);
    }

    public long nextId() {
        return ids.getAndIncrement();
    }

    public @NotNull ExchangeResult call(@NotNull String method, @Nullable Map<String, Object> params) {
        return send(JsonRpcRequest.request(nextId(), method, params));
    }

    /**
     * Handshake as the probe's own client
     */
    public @NotNull ServerInfo initialize() throws IOException {
        return initialize(CLIENT_NAME, CLIENT_VERSION, McpRequests.PROTOCOL_VERSION, Map.of());
    }

    /**
     * Send initialize and, when it succeeds, the initialized notification.
     *
     * @throws ProtocolException if the server did not answer with a result
     * @throws IOException       if the notification could not be written
     */
    public @NotNull ServerInfo initialize(@NotNull String clientName, @NotNull String clientVersion,
                                          @NotNull String protocolVersion, @NotNull Map<String, Object> capabilities)
            throws IOException {
        ExchangeResult result = send(McpRequests.initialize(nextId(), protocolVersion, clientName, clientVersion, capabilities));
        JsonNode node = McpResponses.requireResult(McpRequests.INITIALIZE, result);
        ServerInfo info = ServerInfo.fromInitializeResult(node);
        notifications.notify(McpRequests.initialized());
        this.serverInfo = info;
        return info;
    }

    public @Nullable ServerInfo serverInfo() {
        return serverInfo;
    }

    /**
     * All items of a capability kind, following {@code nextCursor} for a bounded number of pages.
     */
    public @NotNull List<JsonNode> listAll(@NotNull String kind) throws ProtocolException {
        String method = McpRequests.listMethod(kind);
        List<JsonNode> items = new ArrayList<>();
        String cursor = null;
        for (int page = 0; page < MAX_LIST_PAGES; page++) {
            JsonNode result = McpResponses.requireResult(method, send(McpRequests.list(nextId(), kind, cursor)));
            McpResponses.requireArray(method, result, kind).forEach(items::add);
            JsonNode next = result.get("nextCursor");
            if (next == null || next.isNull() || next.asText().isEmpty()) {
                break;
            }
            cursor = next.asText();
        }
        return items;
    }
}

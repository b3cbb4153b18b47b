package me.bechberger.mcpprobe.protocol;

import org.jetbrains.annotations.NotNull;

/**
 * Sends one request and waits for its response.
 * Implementations bind a process, an exchange and a timeout.
 */
@FunctionalInterface
public interface RequestChannel {

    @NotNull ExchangeResult send(@NotNull JsonRpcRequest request);
}

package me.bechberger.mcpprobe.protocol;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;

/**
 * Outcome of one request/response cycle.
 *
 * @param status   how the cycle ended
 * @param response the matching response, only for {@link Status#RESPONSE}
 * @param elapsed  time from lock acquisition attempt to completion
 * @param error    description for timeouts and I/O errors, or the JSON-RPC error message
 */
public record ExchangeResult(
        @NotNull Status status,
        @Nullable JsonRpcResponse response,
        @NotNull Duration elapsed,
        @Nullable String error
) {

    public enum Status {
        /** A response with the request's id arrived */
        RESPONSE,
        /** No response within the timeout */
        TIMEOUT,
        /** The pipe broke or the server closed its output */
        IO_ERROR
    }

    public static ExchangeResult response(@NotNull JsonRpcResponse response, @NotNull Duration elapsed) {
        String error = response.hasError() ? response.error().toString() : null;
        return new ExchangeResult(Status.RESPONSE, response, elapsed, error);
    }

    public static ExchangeResult timeout(@NotNull Duration elapsed, @NotNull String message) {
        return new ExchangeResult(Status.TIMEOUT, null, elapsed, message);
    }

    public static ExchangeResult ioError(@NotNull Duration elapsed, @NotNull String message) {
        return new ExchangeResult(Status.IO_ERROR, null, elapsed, message);
    }

    /**
     * A response arrived and carries a result rather than an error
     */
    public boolean isSuccess() {
        return status == Status.RESPONSE && response != null && !response.hasError();
    }

    public double elapsedMillis() {
        return elapsed.toNanos() / 1_000_000.0;
    }

    /**
     * Short description of the failure, for error lists
     */
    public String describeFailure() {
        return switch (status) {
            case RESPONSE -> error != null ? error : "unexpected response";
            case TIMEOUT -> "timeout" + (error != null ? ": " + error : "");
            case IO_ERROR -> "I/O error" + (error != null ? ": " + error : "");
        };
    }
}

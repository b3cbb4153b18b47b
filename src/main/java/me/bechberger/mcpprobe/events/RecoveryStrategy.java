package me.bechberger.mcpprobe.events;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * @param maxRetries how often {@link RecoveryAction#RETRY} may be answered for the same step
 * @param retryDelay pause before a retry
 */
public record RecoveryStrategy(@NotNull RecoveryAction action, int maxRetries, @NotNull Duration retryDelay) {

    public RecoveryStrategy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
    }

    public static RecoveryStrategy of(@NotNull RecoveryAction action) {
        return new RecoveryStrategy(action, 0, Duration.ZERO);
    }

    public static RecoveryStrategy retry(int maxRetries, @NotNull Duration delay) {
        return new RecoveryStrategy(RecoveryAction.RETRY, maxRetries, delay);
    }
}

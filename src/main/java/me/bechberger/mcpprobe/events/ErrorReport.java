package me.bechberger.mcpprobe.events;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * An error reported to the {@link ErrorHandler}.
 *
 * @param attempt 1 for the first failure of a step, incremented on each retry
 */
public record ErrorReport(
        @NotNull ErrorCategory category,
        @NotNull ErrorSeverity severity,
        @NotNull String message,
        @Nullable String phase,
        int attempt,
        Map<String, String> details,
        Instant timestamp
) {

    public ErrorReport {
        details = Map.copyOf(details);
    }

    public static ErrorReport of(@NotNull ErrorCategory category, @NotNull ErrorSeverity severity,
                                 @NotNull String message, @Nullable String phase, int attempt) {
        return new ErrorReport(category, severity, message, phase, attempt, Map.of(), Instant.now());
    }
}

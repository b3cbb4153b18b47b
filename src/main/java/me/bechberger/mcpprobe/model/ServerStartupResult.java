package me.bechberger.mcpprobe.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Outcome of starting the server and confirming it stays up.
 *
 * @param pid                null when no process was spawned
 * @param startupTimeSeconds time from spawn to the confirmed liveness check
 * @param logs               stderr lines that are not errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerStartupResult(
        boolean success,
        @Nullable Long pid,
        double startupTimeSeconds,
        List<String> errors,
        List<String> logs,
        @Nullable String entryCommand
) implements PhaseResult {

    public ServerStartupResult {
        errors = List.copyOf(errors);
        logs = List.copyOf(logs);
    }

    public static ServerStartupResult skipped(String reason) {
        return new ServerStartupResult(false, null, 0.0, List.of(reason), List.of(), null);
    }
}

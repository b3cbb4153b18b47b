package me.bechberger.mcpprobe.events;

import org.jetbrains.annotations.NotNull;

/**
 * Decides how a run continues after an error.
 */
@FunctionalInterface
public interface ErrorHandler {

    @NotNull RecoveryAction handle(@NotNull ErrorReport report);
}

package me.bechberger.mcpprobe.events;

import org.jetbrains.annotations.NotNull;

/**
 * Receives progress of a validation or test run, keyed by project id and phase name.
 */
public interface ProgressListener {

    ProgressListener NOOP = new ProgressListener() {
    };

    default void phaseStarted(@NotNull String projectId, @NotNull String phase, @NotNull String message) {
    }

    /**
     * @param percent completion of the phase, 0 to 100
     */
    default void progress(@NotNull String projectId, @NotNull String phase, int percent, @NotNull String message) {
    }

    default void phaseCompleted(@NotNull String projectId, @NotNull String phase, @NotNull String message) {
    }

    default void error(@NotNull String projectId, @NotNull String phase, @NotNull String message) {
    }

    default void warning(@NotNull String projectId, @NotNull String phase, @NotNull String message) {
    }
}

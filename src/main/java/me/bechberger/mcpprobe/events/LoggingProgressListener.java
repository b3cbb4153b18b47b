package me.bechberger.mcpprobe.events;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes progress events to the log.
 */
public class LoggingProgressListener implements ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void phaseStarted(@NotNull String projectId, @NotNull String phase, @NotNull String message) {
        log.info("[{}] {} started: {}", projectId, phase, message);
    }

    @Override
    public void progress(@NotNull String projectId, @NotNull String phase, int percent, @NotNull String message) {
        log.debug("[{}] {} {}%: {}", projectId, phase, percent, message);
    }

    @Override
    public void phaseCompleted(@NotNull String projectId, @NotNull String phase, @NotNull String message) {
        log.info("[{}] {} completed: {}", projectId, phase, message);
    }

    @Override
    public void error(@NotNull String projectId, @NotNull String phase, @NotNull String message) {
        log.error("[{}] {}: {}", projectId, phase, message);
    }

    @Override
    public void warning(@NotNull String projectId, @NotNull String phase, @NotNull String message) {
        log.warn("[{}] {}: {}", projectId, phase, message);
    }
}

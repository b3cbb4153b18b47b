package me.bechberger.mcpprobe.process;

import java.io.IOException;

/**
 * Thrown when a server process cannot be spawned: missing working directory,
 * executable not found or not permitted to run.
 */
public class ProcessStartException extends IOException {

    public ProcessStartException(String message) {
        super(message);
    }

    public ProcessStartException(String message, Throwable cause) {
        super(message, cause);
    }
}

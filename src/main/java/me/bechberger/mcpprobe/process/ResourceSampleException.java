package me.bechberger.mcpprobe.process;

/**
 * Resource usage of a process could not be determined.
 */
public class ResourceSampleException extends Exception {

    public ResourceSampleException(String message) {
        super(message);
    }

    public ResourceSampleException(String message, Throwable cause) {
        super(message, cause);
    }
}

package me.bechberger.mcpprobe.process;

/**
 * Source of resource samples for one process.
 */
@FunctionalInterface
public interface ResourceProbe {

    ResourceSample sample() throws ResourceSampleException;

    /**
     * Probe that always fails, for runs without a real process
     */
    static ResourceProbe unavailable() {
        return () -> {
            throw new ResourceSampleException("No process to sample");
        };
    }
}

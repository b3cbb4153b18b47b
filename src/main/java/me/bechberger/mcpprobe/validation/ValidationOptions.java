package me.bechberger.mcpprobe.validation;

import me.bechberger.mcpprobe.model.ValidationLevel;
import me.bechberger.mcpprobe.process.EntryCommand;
import me.bechberger.mcpprobe.protocol.McpRequests;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;

/**
 * Settings for a validation run.
 */
public class ValidationOptions {

    public static final List<String> DEFAULT_BASELINE = List.of(
            McpRequests.INITIALIZE, McpRequests.TOOLS_LIST, McpRequests.RESOURCES_LIST, McpRequests.PROMPTS_LIST);

    private ValidationLevel level = ValidationLevel.STANDARD;
    private EntryCommand entryCommand = null;
    private Duration startupWindow = Duration.ofSeconds(2);
    private Duration startupTimeout = Duration.ofSeconds(30);
    private Duration requestTimeout = Duration.ofSeconds(10);
    private boolean probeStartup = true;
    private boolean allowShortLivedExit = false;
    private List<String> baselineCapabilities = DEFAULT_BASELINE;
    private int maxItemsPerKind = 5;
    private Duration slowStartupThreshold = Duration.ofSeconds(5);

    private ValidationOptions() {
    }

    public static ValidationOptions defaults() {
        return new ValidationOptions();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ValidationLevel getLevel() { return level; }
    /** Explicit entry command, null to detect it from the project files */
    public @Nullable EntryCommand getEntryCommand() { return entryCommand; }
    /** How long the process is watched after spawning */
    public Duration getStartupWindow() { return startupWindow; }
    /** How long the readiness probe may wait for the first response */
    public Duration getStartupTimeout() { return startupTimeout; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public boolean isProbeStartup() { return probeStartup; }
    public boolean isAllowShortLivedExit() { return allowShortLivedExit; }
    public List<String> getBaselineCapabilities() { return baselineCapabilities; }
    public int getMaxItemsPerKind() { return maxItemsPerKind; }
    public Duration getSlowStartupThreshold() { return slowStartupThreshold; }

    public Builder toBuilder() {
        return builder()
                .level(level)
                .entryCommand(entryCommand)
                .startupWindow(startupWindow)
                .startupTimeout(startupTimeout)
                .requestTimeout(requestTimeout)
                .probeStartup(probeStartup)
                .allowShortLivedExit(allowShortLivedExit)
                .baselineCapabilities(baselineCapabilities)
                .maxItemsPerKind(maxItemsPerKind)
                .slowStartupThreshold(slowStartupThreshold);
    }

    public static class Builder {
        private final ValidationOptions options = new ValidationOptions();

        public Builder level(ValidationLevel level) {
            options.level = level;
            return this;
        }

        public Builder entryCommand(@Nullable EntryCommand command) {
            options.entryCommand = command;
            return this;
        }

        public Builder startupWindow(Duration window) {
            options.startupWindow = window;
            return this;
        }

        public Builder startupTimeout(Duration timeout) {
            options.startupTimeout = timeout;
            return this;
        }

        public Builder requestTimeout(Duration timeout) {
            options.requestTimeout = timeout;
            return this;
        }

        public Builder probeStartup(boolean probe) {
            options.probeStartup = probe;
            return this;
        }

        public Builder allowShortLivedExit(boolean allow) {
            options.allowShortLivedExit = allow;
            return this;
        }

        public Builder baselineCapabilities(List<String> baseline) {
            options.baselineCapabilities = List.copyOf(baseline);
            return this;
        }

        public Builder maxItemsPerKind(int max) {
            options.maxItemsPerKind = max;
            return this;
        }

        public Builder slowStartupThreshold(Duration threshold) {
            options.slowStartupThreshold = threshold;
            return this;
        }

        /**
         * @throws IllegalArgumentException for non-positive durations or item limits
         */
        public ValidationOptions build() {
            requirePositive("startup window", options.startupWindow);
            requirePositive("startup timeout", options.startupTimeout);
            requirePositive("request timeout", options.requestTimeout);
            requirePositive("slow startup threshold", options.slowStartupThreshold);
            if (options.maxItemsPerKind <= 0) {
                throw new IllegalArgumentException("maxItemsPerKind must be positive: " + options.maxItemsPerKind);
            }
            if (options.level == null) {
                throw new IllegalArgumentException("Validation level must be set");
            }
            return options;
        }

        private static void requirePositive(String name, Duration duration) {
            if (duration == null || duration.isZero() || duration.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive: " + duration);
            }
        }
    }
}

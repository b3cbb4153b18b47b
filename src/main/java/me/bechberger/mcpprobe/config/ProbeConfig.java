package me.bechberger.mcpprobe.config;

import me.bechberger.mcpprobe.model.ValidationLevel;
import me.bechberger.mcpprobe.process.EntryCommand;
import me.bechberger.mcpprobe.testing.TestOptions;
import me.bechberger.mcpprobe.validation.ValidationOptions;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Settings read from a config file. Every field is optional; absent fields keep the builder's value.
 * Durations are strings like {@code 30s} or {@code 500ms}.
 */
public record ProbeConfig(
        @Nullable String level,
        @Nullable String entryCommand,
        @Nullable String startupTimeout,
        @Nullable String requestTimeout,
        @Nullable Boolean keepGoing,
        @Nullable List<String> baselineCapabilities,
        @Nullable Integer maxItemsPerKind,
        @Nullable Integer maxWorkers,
        @Nullable Integer benchmarkRequests,
        @Nullable List<Integer> loadUserLevels,
        @Nullable Integer requestsPerUser,
        @Nullable Double maxErrorRate,
        @Nullable Double minCompatibilityScore,
        @Nullable Boolean includePerformance,
        @Nullable Boolean includeIntegration,
        @Nullable Boolean includeLoadTesting,
        @Nullable Boolean includeSecurity
) {

    public static final ProbeConfig EMPTY = new ProbeConfig(null, null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null);

    public boolean isKeepGoing() {
        return Boolean.TRUE.equals(keepGoing);
    }

    public ValidationOptions.Builder applyTo(ValidationOptions.Builder builder) {
        if (level != null) {
            builder.level(ValidationLevel.fromString(level));
        }
        if (entryCommand != null) {
            builder.entryCommand(EntryCommand.parse(entryCommand));
        }
        if (startupTimeout != null) {
            builder.startupTimeout(Durations.parse(startupTimeout));
        }
        if (requestTimeout != null) {
            builder.requestTimeout(Durations.parse(requestTimeout));
        }
        if (baselineCapabilities != null) {
            builder.baselineCapabilities(baselineCapabilities);
        }
        if (maxItemsPerKind != null) {
            builder.maxItemsPerKind(maxItemsPerKind);
        }
        return builder;
    }

    public TestOptions.Builder applyTo(TestOptions.Builder builder) {
        if (requestTimeout != null) {
            builder.requestTimeout(Durations.parse(requestTimeout));
        }
        if (maxWorkers != null) {
            builder.maxWorkers(maxWorkers);
        }
        if (benchmarkRequests != null) {
            builder.benchmarkRequests(benchmarkRequests);
        }
        if (loadUserLevels != null) {
            builder.loadUserLevels(loadUserLevels);
        }
        if (requestsPerUser != null) {
            builder.requestsPerUser(requestsPerUser);
        }
        if (maxErrorRate != null) {
            builder.maxErrorRate(maxErrorRate);
        }
        if (minCompatibilityScore != null) {
            builder.minCompatibilityScore(minCompatibilityScore);
        }
        if (includePerformance != null) {
            builder.includePerformance(includePerformance);
        }
        if (includeIntegration != null) {
            builder.includeIntegration(includeIntegration);
        }
        if (includeLoadTesting != null) {
            builder.includeLoadTesting(includeLoadTesting);
        }
        if (includeSecurity != null) {
            builder.includeSecurity(includeSecurity);
        }
        return builder;
    }
}

package me.bechberger.mcpprobe.events;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable lookup from (category, severity) to a recovery strategy.
 * Built once and shared by reference.
 */
public final class RecoveryTable {

    private static final RecoveryStrategy FALLBACK = RecoveryStrategy.of(RecoveryAction.ABORT);

    private final Map<ErrorCategory, Map<ErrorSeverity, RecoveryStrategy>> strategies;

    private RecoveryTable(Map<ErrorCategory, Map<ErrorSeverity, RecoveryStrategy>> strategies) {
        Map<ErrorCategory, Map<ErrorSeverity, RecoveryStrategy>> copy = new EnumMap<>(ErrorCategory.class);
        strategies.forEach((category, bySeverity) -> copy.put(category, Map.copyOf(bySeverity)));
        this.strategies = Map.copyOf(copy);
    }

    /**
     * Retries transient failures, aborts on failed validation phases.
     */
    public static RecoveryTable defaults() {
        return baseBuilder()
                .put(ErrorCategory.VALIDATION, ErrorSeverity.LOW, RecoveryStrategy.of(RecoveryAction.SKIP))
                .put(ErrorCategory.VALIDATION, ErrorSeverity.MEDIUM, RecoveryStrategy.of(RecoveryAction.ABORT))
                .put(ErrorCategory.VALIDATION, ErrorSeverity.HIGH, RecoveryStrategy.of(RecoveryAction.ABORT))
                .build();
    }

    /**
     * Like {@link #defaults()} but keeps going after failed validation phases, for partial results.
     */
    public static RecoveryTable lenient() {
        return baseBuilder()
                .put(ErrorCategory.VALIDATION, ErrorSeverity.LOW, RecoveryStrategy.of(RecoveryAction.SKIP))
                .put(ErrorCategory.VALIDATION, ErrorSeverity.MEDIUM, RecoveryStrategy.of(RecoveryAction.SKIP))
                .put(ErrorCategory.VALIDATION, ErrorSeverity.HIGH, RecoveryStrategy.of(RecoveryAction.SKIP))
                .build();
    }

    private static Builder baseBuilder() {
        return builder()
                .put(ErrorCategory.NETWORK, ErrorSeverity.MEDIUM, RecoveryStrategy.retry(3, Duration.ofSeconds(2)))
                .put(ErrorCategory.FILE_SYSTEM, ErrorSeverity.MEDIUM, RecoveryStrategy.retry(2, Duration.ofSeconds(1)))
                .put(ErrorCategory.DEPENDENCY, ErrorSeverity.MEDIUM, RecoveryStrategy.retry(2, Duration.ofSeconds(1)))
                .put(ErrorCategory.TEMPLATE, ErrorSeverity.HIGH, RecoveryStrategy.of(RecoveryAction.ABORT))
                .put(ErrorCategory.BUILD, ErrorSeverity.HIGH, RecoveryStrategy.of(RecoveryAction.MANUAL))
                .put(ErrorCategory.SYSTEM, ErrorSeverity.CRITICAL, RecoveryStrategy.of(RecoveryAction.ABORT));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Strategy for the pair, {@link RecoveryAction#ABORT} when none is registered
     */
    public @NotNull RecoveryStrategy lookup(@NotNull ErrorCategory category, @NotNull ErrorSeverity severity) {
        Map<ErrorSeverity, RecoveryStrategy> bySeverity = strategies.get(category);
        if (bySeverity == null) {
            return FALLBACK;
        }
        return bySeverity.getOrDefault(severity, FALLBACK);
    }

    public static class Builder {
        private final Map<ErrorCategory, Map<ErrorSeverity, RecoveryStrategy>> strategies = new EnumMap<>(ErrorCategory.class);

        public Builder put(@NotNull ErrorCategory category, @NotNull ErrorSeverity severity, @NotNull RecoveryStrategy strategy) {
            strategies.computeIfAbsent(category, c -> new EnumMap<>(ErrorSeverity.class)).put(severity, strategy);
            return this;
        }

        public RecoveryTable build() {
            return new RecoveryTable(strategies);
        }
    }
}

package me.bechberger.mcpprobe.validation;

import me.bechberger.mcpprobe.model.PhaseResult;
import org.jetbrains.annotations.NotNull;

/**
 * One phase of validation, run against its own server process.
 *
 * @param <R> The type of result this check produces
 */
public interface ValidationCheck<R extends PhaseResult> {

    @NotNull ValidationPhase getPhase();

    /**
     * Run the check. Failures are reported in the result, not thrown.
     */
    @NotNull R run(@NotNull ValidationContext context);

    /**
     * Failed result for a check that did not run or crashed
     */
    @NotNull R failed(@NotNull ValidationContext context, @NotNull String reason);
}

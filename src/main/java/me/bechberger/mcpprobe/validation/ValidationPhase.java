package me.bechberger.mcpprobe.validation;

import me.bechberger.mcpprobe.events.ErrorSeverity;

/**
 * States of a validation run, in order.
 */
public enum ValidationPhase {
    IDLE("idle", null),
    STARTUP("startup", ErrorSeverity.HIGH),
    PROTOCOL("protocol", ErrorSeverity.MEDIUM),
    FUNCTIONALITY("functionality", ErrorSeverity.LOW),
    DONE("done", null);

    private final String displayName;
    private final ErrorSeverity failureSeverity;

    ValidationPhase(String displayName, ErrorSeverity failureSeverity) {
        this.displayName = displayName;
        this.failureSeverity = failureSeverity;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Severity reported to the error handler when this phase fails
     */
    public ErrorSeverity getFailureSeverity() {
        return failureSeverity;
    }
}

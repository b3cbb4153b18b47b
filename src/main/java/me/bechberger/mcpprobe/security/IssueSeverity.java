package me.bechberger.mcpprobe.security;

/**
 * Severity of a security issue, most severe first.
 */
public enum IssueSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public boolean isAtLeast(IssueSeverity other) {
        return ordinal() <= other.ordinal();
    }
}

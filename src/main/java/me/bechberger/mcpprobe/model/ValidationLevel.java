package me.bechberger.mcpprobe.model;

/**
 * How much of a server is exercised during validation.
 */
public enum ValidationLevel {
    /** Startup and protocol handshake only */
    BASIC,
    /** Verifies advertised list methods and exercises a few items of each kind */
    STANDARD,
    /** Exercises every listed item */
    COMPREHENSIVE;

    public static ValidationLevel fromString(String level) {
        if (level == null) {
            return STANDARD;
        }
        return switch (level.toLowerCase()) {
            case "basic" -> BASIC;
            case "standard" -> STANDARD;
            case "comprehensive", "full" -> COMPREHENSIVE;
            default -> throw new IllegalArgumentException("Unknown validation level: " + level);
        };
    }

    public boolean atLeast(ValidationLevel other) {
        return compareTo(other) >= 0;
    }
}

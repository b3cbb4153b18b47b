package me.bechberger.mcpprobe.events;

/**
 * Area an error originates from.
 */
public enum ErrorCategory {
    TEMPLATE,
    FILE_SYSTEM,
    NETWORK,
    DEPENDENCY,
    BUILD,
    VALIDATION,
    CONFIGURATION,
    SYSTEM
}

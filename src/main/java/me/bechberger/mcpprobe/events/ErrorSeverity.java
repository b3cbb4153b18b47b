package me.bechberger.mcpprobe.events;

public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}

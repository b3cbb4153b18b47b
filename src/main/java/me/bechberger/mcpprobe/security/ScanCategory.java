package me.bechberger.mcpprobe.security;

public enum ScanCategory {
    DEPENDENCY,
    CODE,
    CONFIGURATION
}

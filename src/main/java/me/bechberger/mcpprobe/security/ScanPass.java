package me.bechberger.mcpprobe.security;

import org.jetbrains.annotations.NotNull;

/**
 * One independent pass of the security scanner.
 */
public interface ScanPass {

    @NotNull String getName();

    @NotNull ScanCategory getCategory();

    /**
     * Scan the project. Must not modify the file system.
     */
    @NotNull PassResult scan(@NotNull ScanContext context);
}

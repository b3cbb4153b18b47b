package me.bechberger.mcpprobe.model;

import java.util.List;

/**
 * Result of one validation phase.
 */
public interface PhaseResult {

    boolean success();

    List<String> errors();
}

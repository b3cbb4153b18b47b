package me.bechberger.mcpprobe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A finished report that can be rendered and turned into an exit code.
 */
public interface Report {

    /**
     * Whether the checked project passed
     */
    @JsonIgnore
    boolean isSuccessful();

    /**
     * One-line summary
     */
    String getSummary();
}

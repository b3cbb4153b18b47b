package me.bechberger.mcpprobe.security;

import java.util.List;

/**
 * Findings of one scan pass.
 */
public record PassResult(List<SecurityIssue> issues, List<String> recommendations) {

    public PassResult {
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
    }
}

package me.bechberger.mcpprobe.security;

/**
 * A single finding.
 *
 * @param type     short machine-readable kind, e.g. {@code shell_injection}
 * @param category the pass that found it
 * @param file     path relative to the project root
 * @param line     1-based line, 0 when the finding is not tied to a line
 */
public record SecurityIssue(
        String type,
        ScanCategory category,
        String file,
        int line,
        String description,
        IssueSeverity severity
) {

    /**
     * {@code file:line}, or just the file for file-level findings
     */
    public String location() {
        return line > 0 ? file + ":" + line : file;
    }
}

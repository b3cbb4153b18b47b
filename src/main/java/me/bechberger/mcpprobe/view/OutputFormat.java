package me.bechberger.mcpprobe.view;

/**
 * Output format for rendering reports.
 */
public enum OutputFormat {
    /** Plain text for CLI (with optional ANSI colors) */
    TEXT,
    /** HTML for web viewing */
    HTML,
    /** JSON for machine processing */
    JSON,
    /** YAML for human-readable machine format */
    YAML;

    /**
     * Parse a format from string (case-insensitive)
     *
     * @throws IllegalArgumentException for unknown formats
     */
    public static OutputFormat fromString(String format) {
        if (format == null) {
            return TEXT;
        }
        return switch (format.toLowerCase()) {
            case "text", "txt", "cli" -> TEXT;
            case "html", "htm" -> HTML;
            case "json" -> JSON;
            case "yaml", "yml" -> YAML;
            default -> throw new IllegalArgumentException("Unknown output format: " + format);
        };
    }

    /**
     * Get file extension for this format
     */
    public String getExtension() {
        return switch (this) {
            case TEXT -> "txt";
            case HTML -> "html";
            case JSON -> "json";
            case YAML -> "yaml";
        };
    }
}

package me.bechberger.mcpprobe.view;

/**
 * Options for controlling output rendering.
 */
public class OutputOptions {

    private OutputFormat format = OutputFormat.TEXT;
    private boolean colorEnabled;
    private boolean verbose = false;

    private OutputOptions() {
        // Auto-detect color support
        this.colorEnabled = detectColorSupport();
    }

    public static OutputOptions defaults() {
        return new OutputOptions();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean detectColorSupport() {
        String term = System.getenv("TERM");
        String colorTerm = System.getenv("COLORTERM");
        String noColor = System.getenv("NO_COLOR");

        if (noColor != null && !noColor.isEmpty()) {
            return false;
        }

        if (colorTerm != null && !colorTerm.isEmpty()) {
            return true;
        }

        if (term != null) {
            return term.contains("color") || term.contains("xterm") ||
                   term.contains("256") || term.contains("ansi");
        }

        return System.console() != null;
    }

    public OutputFormat getFormat() { return format; }
    public boolean isColorEnabled() { return colorEnabled; }
    public boolean isVerbose() { return verbose; }

    public static class Builder {
        private final OutputOptions options = new OutputOptions();

        public Builder format(OutputFormat format) {
            options.format = format;
            return this;
        }

        public Builder colorEnabled(boolean enabled) {
            options.colorEnabled = enabled;
            return this;
        }

        public Builder noColor() {
            options.colorEnabled = false;
            return this;
        }

        public Builder verbose(boolean verbose) {
            options.verbose = verbose;
            return this;
        }

        public OutputOptions build() {
            return options;
        }
    }
}

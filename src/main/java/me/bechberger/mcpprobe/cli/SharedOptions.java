package me.bechberger.mcpprobe.cli;

import me.bechberger.mcpprobe.model.Report;
import me.bechberger.mcpprobe.view.OutputFormat;
import me.bechberger.mcpprobe.view.OutputOptions;
import me.bechberger.mcpprobe.view.ViewRendererFactory;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared command options mixin.
 * Use with @Mixin annotation in commands.
 */
public class SharedOptions {

    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.me.bechberger.mcpprobe";

    @Option(names = {"--color"}, description = "Force colored output", negatable = true)
    private Boolean colorEnabled = null;

    @Option(names = {"-o", "--output"}, description = "Output format: text, json, yaml, html (default: ${DEFAULT-VALUE})")
    private String outputFormat = "text";

    @Option(names = {"--output-file"}, description = "Write the report to this file instead of stdout")
    private Path outputFile;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output and debug logging")
    private boolean verbose = false;

    @Option(names = {"-q", "--quiet"}, description = "Only log errors")
    private boolean quiet = false;

    public Boolean getColorEnabled() {
        return colorEnabled;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public Path getOutputFile() {
        return outputFile;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Set the log level of the probe's loggers. Must run before the first of them is created.
     */
    public void configureLogging() {
        if (verbose) {
            System.setProperty(LOG_LEVEL_PROPERTY, "debug");
        } else if (quiet) {
            System.setProperty(LOG_LEVEL_PROPERTY, "error");
        }
    }

    /**
     * Build OutputOptions from shared options
     *
     * @throws IllegalArgumentException for unknown output formats
     */
    public OutputOptions buildOutputOptions() {
        OutputOptions.Builder builder = OutputOptions.builder()
                .format(OutputFormat.fromString(outputFormat))
                .verbose(verbose);

        if (outputFile != null) {
            builder.noColor();
        } else if (colorEnabled != null) {
            builder.colorEnabled(colorEnabled);
        }

        return builder.build();
    }

    /**
     * Render the report and print it or write it to the output file
     */
    public void emit(Report report, OutputOptions options) throws IOException {
        String output = ViewRendererFactory.render(report, options);
        if (outputFile != null) {
            Files.writeString(outputFile, output);
            verboseLog("Report written to: " + outputFile);
        } else {
            System.out.println(output);
        }
    }

    /**
     * Print verbose message if verbose mode is enabled
     */
    public void verboseLog(String message) {
        if (verbose) {
            System.err.println(message);
        }
    }

    /**
     * Print error message
     */
    public void errorLog(String message) {
        System.err.println("Error: " + message);
    }

    /**
     * Print warning message
     */
    public void warnLog(String message) {
        System.err.println("Warning: " + message);
    }
}

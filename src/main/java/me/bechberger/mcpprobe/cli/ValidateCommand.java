package me.bechberger.mcpprobe.cli;

import me.bechberger.mcpprobe.events.LoggingProgressListener;
import me.bechberger.mcpprobe.model.ValidationReport;
import me.bechberger.mcpprobe.validation.ValidationEngine;
import me.bechberger.mcpprobe.validation.ValidationOptions;
import me.bechberger.mcpprobe.view.OutputOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Validate command - starts the server and checks startup, protocol compliance and functionality.
 *
 * Usage: mcpprobe validate <path> [--level standard] [--entry-command "python server.py"]
 */
@Command(
        name = "validate",
        description = "Validate an MCP server project: startup, protocol compliance and functionality",
        mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    @Mixin
    private SharedOptions sharedOptions;

    @Mixin
    private ServerOptions serverOptions;

    @Parameters(index = "0", description = "Server project directory")
    private Path projectPath;

    /** Exit codes */
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;

    @Override
    public Integer call() {
        sharedOptions.configureLogging();
        if (!Files.isDirectory(projectPath)) {
            sharedOptions.errorLog("Not a directory: " + projectPath);
            return EXIT_FAILED;
        }
        try {
            OutputOptions outputOptions = sharedOptions.buildOutputOptions();
            ValidationOptions options = serverOptions.buildValidationOptions();
            ValidationEngine engine = serverOptions.buildEngine(options, new LoggingProgressListener());
            sharedOptions.verboseLog("Validating " + projectPath.toAbsolutePath() + " at level "
                    + options.getLevel().name().toLowerCase());

            ValidationReport report = engine.validate(projectPath.toAbsolutePath());
            sharedOptions.emit(report, outputOptions);
            return report.isSuccessful() ? EXIT_OK : EXIT_FAILED;
        } catch (IllegalArgumentException e) {
            sharedOptions.errorLog("Invalid configuration: " + e.getMessage());
            return EXIT_FAILED;
        } catch (IOException e) {
            sharedOptions.errorLog(e.getMessage());
            return EXIT_FAILED;
        }
    }
}

package me.bechberger.mcpprobe.cli;

import me.bechberger.mcpprobe.security.SecurityScanResult;
import me.bechberger.mcpprobe.security.SecurityScanner;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Scan command - static security scan without starting the server.
 *
 * Usage: mcpprobe scan <path>
 */
@Command(
        name = "scan",
        description = "Scan an MCP server project for vulnerable dependencies, risky code and exposed secrets",
        mixinStandardHelpOptions = true
)
public class ScanCommand implements Callable<Integer> {

    @Mixin
    private SharedOptions sharedOptions;

    @Parameters(index = "0", description = "Server project directory")
    private Path projectPath;

    /** Exit codes */
    public static final int EXIT_OK = 0;
    public static final int EXIT_CRITICAL = 1;

    @Override
    public Integer call() {
        sharedOptions.configureLogging();
        if (!Files.isDirectory(projectPath)) {
            sharedOptions.errorLog("Not a directory: " + projectPath);
            return EXIT_CRITICAL;
        }
        try {
            SecurityScanResult result = SecurityScanner.createDefault().scan(projectPath.toAbsolutePath());
            for (String warning : result.warnings()) {
                sharedOptions.warnLog(warning);
            }
            sharedOptions.emit(result, sharedOptions.buildOutputOptions());
            return result.isSuccessful() ? EXIT_OK : EXIT_CRITICAL;
        } catch (IllegalArgumentException e) {
            sharedOptions.errorLog("Invalid configuration: " + e.getMessage());
            return EXIT_CRITICAL;
        } catch (IOException e) {
            sharedOptions.errorLog(e.getMessage());
            return EXIT_CRITICAL;
        }
    }
}

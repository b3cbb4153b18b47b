package me.bechberger.mcpprobe.cli;

import me.bechberger.mcpprobe.events.LoggingProgressListener;
import me.bechberger.mcpprobe.events.ProgressListener;
import me.bechberger.mcpprobe.model.ComprehensiveTestReport;
import me.bechberger.mcpprobe.security.SecurityScanner;
import me.bechberger.mcpprobe.testing.ComprehensiveTester;
import me.bechberger.mcpprobe.testing.TestOptions;
import me.bechberger.mcpprobe.validation.ValidationEngine;
import me.bechberger.mcpprobe.validation.ValidationOptions;
import me.bechberger.mcpprobe.view.OutputOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Test command - validation followed by benchmarks, integration and load tests and a security scan.
 *
 * Usage: mcpprobe test <path> [--max-workers 4] [--skip-load-testing]
 */
@Command(
        name = "test",
        description = "Run comprehensive tests: validation, performance, integration, load and security",
        mixinStandardHelpOptions = true
)
public class TestCommand implements Callable<Integer> {

    @Mixin
    private SharedOptions sharedOptions;

    @Mixin
    private ServerOptions serverOptions;

    @Parameters(index = "0", description = "Server project directory")
    private Path projectPath;

    @Option(names = {"--max-workers"}, description = "Worker threads for load testing (default: 4)")
    private Integer maxWorkers;

    @Option(names = {"--skip-performance"}, description = "Skip performance benchmarks")
    private boolean skipPerformance = false;

    @Option(names = {"--skip-integration"}, description = "Skip client integration tests")
    private boolean skipIntegration = false;

    @Option(names = {"--skip-load-testing"}, description = "Skip load testing")
    private boolean skipLoadTesting = false;

    @Option(names = {"--skip-security"}, description = "Skip the security scan")
    private boolean skipSecurity = false;

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
            ValidationOptions validationOptions = serverOptions.buildValidationOptions();
            TestOptions testOptions = buildTestOptions();
            ProgressListener progress = new LoggingProgressListener();
            ValidationEngine engine = serverOptions.buildEngine(validationOptions, progress);
            ComprehensiveTester tester = new ComprehensiveTester(engine, testOptions, progress,
                    SecurityScanner.createDefault());

            ComprehensiveTestReport report = tester.test(projectPath.toAbsolutePath());
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

    TestOptions buildTestOptions() throws IOException {
        TestOptions.Builder builder = serverOptions.config().applyTo(TestOptions.builder());
        if (maxWorkers != null) {
            builder.maxWorkers(maxWorkers);
        }
        if (skipPerformance) {
            builder.includePerformance(false);
        }
        if (skipIntegration) {
            builder.includeIntegration(false);
        }
        if (skipLoadTesting) {
            builder.includeLoadTesting(false);
        }
        if (skipSecurity) {
            builder.includeSecurity(false);
        }
        return builder.build();
    }
}

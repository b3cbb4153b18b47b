package me.bechberger.mcpprobe.validation;

import me.bechberger.mcpprobe.events.DefaultErrorHandler;
import me.bechberger.mcpprobe.events.ErrorCategory;
import me.bechberger.mcpprobe.events.ErrorHandler;
import me.bechberger.mcpprobe.events.ErrorReport;
import me.bechberger.mcpprobe.events.ProgressListener;
import me.bechberger.mcpprobe.events.RecoveryAction;
import me.bechberger.mcpprobe.model.FunctionalityTestResult;
import me.bechberger.mcpprobe.model.PhaseResult;
import me.bechberger.mcpprobe.model.ProtocolComplianceResult;
import me.bechberger.mcpprobe.model.ServerStartupResult;
import me.bechberger.mcpprobe.model.ValidationLevel;
import me.bechberger.mcpprobe.model.ValidationReport;
import me.bechberger.mcpprobe.process.EntryCommand;
import me.bechberger.mcpprobe.process.EntryPointDetector;
import me.bechberger.mcpprobe.process.ProcessSupervisor;
import me.bechberger.mcpprobe.protocol.ProtocolExchange;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs startup, protocol and functionality checks in order, each against a fresh process.
 * <p>
 * After a failed phase the {@link ErrorHandler} decides: retry the phase, skip to the next one,
 * or stop, in which case the remaining phases are reported as skipped.
 */
public class ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    private final ValidationOptions options;
    private final ProcessSupervisor supervisor;
    private final ProtocolExchange exchange;
    private final ProgressListener progress;
    private final ErrorHandler errorHandler;
    private final EntryPointDetector detector = new EntryPointDetector();

    private final StartupCheck startupCheck = new StartupCheck();
    private final ProtocolCheck protocolCheck = new ProtocolCheck();
    private final FunctionalityCheck functionalityCheck = new FunctionalityCheck();

    private volatile ValidationPhase state = ValidationPhase.IDLE;

    public ValidationEngine(@NotNull ValidationOptions options, @NotNull ProcessSupervisor supervisor,
                            @NotNull ProtocolExchange exchange, @NotNull ProgressListener progress,
                            @NotNull ErrorHandler errorHandler) {
        this.options = options;
        this.supervisor = supervisor;
        this.exchange = exchange;
        this.progress = progress;
        this.errorHandler = errorHandler;
    }

    public ValidationEngine(@NotNull ValidationOptions options) {
        this(options, new ProcessSupervisor(), new ProtocolExchange(), ProgressListener.NOOP, new DefaultErrorHandler());
    }

    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }

    public ProcessSupervisor getSupervisor() {
        return supervisor;
    }

    public ProtocolExchange getExchange() {
        return exchange;
    }

    /**
     * Phase the engine is currently in
     */
    public ValidationPhase getState() {
        return state;
    }

    /**
     * Entry command from the options, or detected from the project files; null if neither
     */
    public EntryCommand resolveEntryCommand(@NotNull Path projectPath) {
        if (options.getEntryCommand() != null) {
            return options.getEntryCommand();
        }
        return detector.detect(projectPath).orElse(null);
    }

    public @NotNull ValidationReport validate(@NotNull Path projectPath) {
        long start = System.nanoTime();
        Instant timestamp = Instant.now();
        EntryCommand command = resolveEntryCommand(projectPath);
        ValidationContext context = new ValidationContext(projectPath, command, options, supervisor, exchange);
        log.info("Validating {} ({}) with {}", projectPath, options.getLevel().name().toLowerCase(),
                command != null ? command.display() : "no entry command");

        PhaseOutcome<ServerStartupResult> startup = runPhase(startupCheck, context);
        ProtocolComplianceResult protocol;
        FunctionalityTestResult functionality;
        try {
            if (startup.stop()) {
                protocol = skip(protocolCheck, context, "Skipped: server startup failed");
                functionality = skip(functionalityCheck, context, "Skipped: server startup failed");
            } else {
                PhaseOutcome<ProtocolComplianceResult> protocolOutcome = runPhase(protocolCheck, context);
                protocol = protocolOutcome.result();
                if (options.getLevel() == ValidationLevel.BASIC) {
                    functionality = FunctionalityTestResult.notExecuted();
                } else if (protocolOutcome.stop()) {
                    functionality = skip(functionalityCheck, context, "Skipped: protocol compliance failed");
                } else {
                    functionality = runPhase(functionalityCheck, context).result();
                }
            }
        } finally {
            state = ValidationPhase.DONE;
        }

        boolean overall = startup.result().success() && protocol.success() && functionality.success();
        ValidationReport report = new ValidationReport(
                projectPath.toString(),
                options.getLevel(),
                overall,
                startup.result(),
                protocol,
                functionality,
                performanceMetrics(startup.result(), functionality),
                ValidationRecommendations.generate(startup.result(), protocol, functionality, options),
                timestamp,
                (System.nanoTime() - start) / 1e9);
        log.info("{}: {}", context.projectId(), report.getSummary());
        return report;
    }

    private record PhaseOutcome<R extends PhaseResult>(R result, boolean stop) {
    }

    private <R extends PhaseResult> PhaseOutcome<R> runPhase(ValidationCheck<R> check, ValidationContext context) {
        ValidationPhase phase = check.getPhase();
        String projectId = context.projectId();
        state = phase;
        progress.phaseStarted(projectId, phase.getDisplayName(), "Running " + phase.getDisplayName() + " check");
        int attempt = 1;
        while (true) {
            R result;
            try {
                result = check.run(context);
            } catch (RuntimeException e) {
                log.error("{} check crashed", phase.getDisplayName(), e);
                result = check.failed(context, phase.getDisplayName() + " check crashed: " + e.getMessage());
            }
            if (result.success()) {
                progress.progress(projectId, phase.getDisplayName(), 100, "passed");
                progress.phaseCompleted(projectId, phase.getDisplayName(), "passed");
                return new PhaseOutcome<>(result, false);
            }

            String message = phase.getDisplayName() + " failed: " + String.join("; ", result.errors());
            RecoveryAction action = errorHandler.handle(ErrorReport.of(ErrorCategory.VALIDATION,
                    phase.getFailureSeverity(), message, phase.getDisplayName(), attempt));
            if (action == RecoveryAction.RETRY) {
                progress.warning(projectId, phase.getDisplayName(), "Retrying after failure (attempt " + attempt + ")");
                attempt++;
                continue;
            }
            progress.error(projectId, phase.getDisplayName(), message);
            progress.phaseCompleted(projectId, phase.getDisplayName(), "failed");
            return new PhaseOutcome<>(result, action.stopsRun());
        }
    }

    private <R extends PhaseResult> R skip(ValidationCheck<R> check, ValidationContext context, String reason) {
        progress.warning(context.projectId(), check.getPhase().getDisplayName(), reason);
        return check.failed(context, reason);
    }

    private static Map<String, Double> performanceMetrics(ServerStartupResult startup, FunctionalityTestResult functionality) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("startup_time_seconds", startup.startupTimeSeconds());
        double total = 0;
        for (String kind : new String[]{"tools", "resources", "prompts"}) {
            double count = functionality.metrics().getOrDefault(kind + "_count", 0.0);
            metrics.put(kind + "_count", count);
            total += count;
        }
        metrics.put("total_capabilities", total);
        functionality.metrics().forEach((key, value) -> {
            if (key.endsWith("_response_time_ms")) {
                metrics.put(key, value);
            }
        });
        return metrics;
    }
}

package me.bechberger.mcpprobe.validation;

import me.bechberger.mcpprobe.model.ServerStartupResult;
import me.bechberger.mcpprobe.process.ProcessStartException;
import me.bechberger.mcpprobe.process.ServerProcess;
import me.bechberger.mcpprobe.protocol.ExchangeResult;
import me.bechberger.mcpprobe.protocol.McpRequests;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Starts the server, watches it for the startup window and checks that it answers a ping.
 * A process that stays silent past the startup timeout fails and is killed.
 */
public class StartupCheck implements ValidationCheck<ServerStartupResult> {

    private static final Logger log = LoggerFactory.getLogger(StartupCheck.class);

    private static final long POLL_INTERVAL_MS = 100;
    private static final long OUTPUT_SETTLE_MS = 500;

    static final Pattern ERROR_MARKER = Pattern.compile("(?i)\\b(error|exception|traceback|fatal|panic)\\b");

    @Override
    public @NotNull ValidationPhase getPhase() {
        return ValidationPhase.STARTUP;
    }

    @Override
    public @NotNull ServerStartupResult run(@NotNull ValidationContext context) {
        ValidationOptions options = context.options();
        List<String> errors = new ArrayList<>();
        List<String> logs = new ArrayList<>();
        String command = context.entryCommand() != null ? context.entryCommand().display() : null;
        Long pid = null;
        double startupSeconds = 0.0;
        long spawn = System.nanoTime();

        try (ServerProcess process = context.startServer()) {
            pid = process.pid();
            boolean alive = observe(process, options.getStartupWindow());

            if (!alive) {
                awaitOutput(process);
                Integer exitCode = process.exitCode();
                logs.addAll(process.pendingStdoutLines());
                if (exitCode != null && exitCode == 0 && options.isAllowShortLivedExit()) {
                    log.debug("{} exited cleanly during startup", process);
                } else {
                    errors.add("Server exited during startup with code " + exitCode);
                    errors.addAll(process.stderrLines());
                }
                startupSeconds = seconds(spawn);
            } else if (options.isProbeStartup()) {
                ExchangeResult probe = context.exchange().call(process, McpRequests.ping("startup-probe"),
                        options.getStartupTimeout());
                switch (probe.status()) {
                    case RESPONSE -> startupSeconds = seconds(spawn);
                    case TIMEOUT -> errors.add("Server produced no output within "
                            + options.getStartupTimeout().toMillis() / 1000.0 + "s");
                    case IO_ERROR -> errors.add("Server closed its output during startup: " + probe.error());
                }
                classifyStderr(process.stderrLines(), errors, logs);
            } else {
                startupSeconds = seconds(spawn);
                classifyStderr(process.stderrLines(), errors, logs);
            }
        } catch (ProcessStartException e) {
            errors.add(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add("Interrupted during startup");
        }

        return new ServerStartupResult(errors.isEmpty(), pid, startupSeconds, errors, logs, command);
    }

    @Override
    public @NotNull ServerStartupResult failed(@NotNull ValidationContext context, @NotNull String reason) {
        return ServerStartupResult.skipped(reason);
    }

    /**
     * Poll liveness until the window has passed.
     *
     * @return whether the process is still alive
     */
    private static boolean observe(ServerProcess process, Duration window) throws InterruptedException {
        long deadline = System.nanoTime() + window.toNanos();
        while (process.isAlive()) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMs <= 0) {
                return true;
            }
            Thread.sleep(Math.min(POLL_INTERVAL_MS, remainingMs));
        }
        return false;
    }

    /**
     * Give the drainer threads a moment to collect what an exited process wrote
     */
    private static void awaitOutput(ServerProcess process) throws InterruptedException {
        long deadline = System.nanoTime() + OUTPUT_SETTLE_MS * 1_000_000;
        while (!process.isStdoutClosed() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }

    static void classifyStderr(List<String> lines, List<String> errors, List<String> logs) {
        for (String line : lines) {
            if (ERROR_MARKER.matcher(line).find()) {
                errors.add(line);
            } else {
                logs.add(line);
            }
        }
    }

    private static double seconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1e9;
    }
}

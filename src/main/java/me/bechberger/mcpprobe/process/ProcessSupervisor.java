package me.bechberger.mcpprobe.process;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Starts server processes and guarantees they are stopped.
 * <p>
 * Every started process is tracked in a {@link ProcessRegistry} until {@link #stop} runs for it;
 * {@link #terminateAll()} sweeps whatever is left.
 */
public class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(1);
    private static final Duration FORCE_KILL_WAIT = Duration.ofSeconds(5);

    private final ProcessRegistry registry;
    private final Duration gracePeriod;

    public ProcessSupervisor() {
        this(new ProcessRegistry(), DEFAULT_GRACE_PERIOD);
    }

    public ProcessSupervisor(@NotNull ProcessRegistry registry, @NotNull Duration gracePeriod) {
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("Grace period must not be negative: " + gracePeriod);
        }
        this.registry = registry;
        this.gracePeriod = gracePeriod;
    }

    public @NotNull ProcessRegistry registry() {
        return registry;
    }

    public @NotNull Duration gracePeriod() {
        return gracePeriod;
    }

    /**
     * Spawn the command in the given directory.
     *
     * @throws ProcessStartException if the directory does not exist or the command cannot be executed
     */
    public @NotNull ServerProcess start(@NotNull Path workingDir, @NotNull EntryCommand command)
            throws ProcessStartException {
        if (!Files.isDirectory(workingDir)) {
            throw new ProcessStartException("Working directory does not exist: " + workingDir);
        }
        ProcessBuilder pb = new ProcessBuilder(command.argv());
        pb.directory(workingDir.toFile());
        Instant startedAt = Instant.now();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ProcessStartException("Failed to start '" + command.display() + "': " + e.getMessage(), e);
        }
        ServerProcess serverProcess = new ServerProcess(process, command, workingDir, startedAt, this);
        registry.register(serverProcess);
        log.debug("Started {} in {}", serverProcess, workingDir);
        return serverProcess;
    }

    /**
     * Stop with the configured grace period
     */
    public void stop(@NotNull ServerProcess serverProcess) {
        stop(serverProcess, gracePeriod);
    }

    /**
     * Stop a process: close stdin, ask it to terminate, force-kill after the grace period.
     * Surviving descendants are killed too. Safe to call repeatedly, never throws, and a child that
     * stopped reading its stdin does not hold it up beyond the grace period.
     */
    public void stop(@NotNull ServerProcess serverProcess, @NotNull Duration grace) {
        if (!serverProcess.markStopped()) {
            registry.unregister(serverProcess);
            return;
        }
        Process process = serverProcess.process();
        List<ProcessHandle> descendants = process.descendants().toList();
        if (!serverProcess.closeStdin(grace)) {
            log.debug("{} is not reading its stdin, terminating without closing it", serverProcess);
        }
        try {
            if (process.isAlive()) {
                process.destroy();
                if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.debug("{} did not exit within {} ms, killing", serverProcess, grace.toMillis());
                    process.destroyForcibly();
                    process.waitFor(FORCE_KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        } finally {
            for (ProcessHandle child : descendants) {
                if (child.isAlive()) {
                    child.destroyForcibly();
                }
            }
            registry.unregister(serverProcess);
        }
        if (process.isAlive()) {
            log.warn("{} is still alive after being killed", serverProcess);
        } else {
            log.debug("Stopped {}", serverProcess);
        }
    }

    /**
     * Stop every process still registered.
     *
     * @return the number of processes that had to be swept
     */
    public int terminateAll() {
        List<ServerProcess> leftovers = registry.activeProcesses();
        for (ServerProcess process : leftovers) {
            stop(process);
        }
        return leftovers.size();
    }
}

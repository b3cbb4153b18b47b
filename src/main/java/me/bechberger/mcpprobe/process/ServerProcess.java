package me.bechberger.mcpprobe.process;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A running server child process with its pipes.
 * <p>
 * Stdout is drained line by line into a queue read by {@link #readLine}, stderr into a bounded
 * buffer, so the child never blocks on a full pipe. Stdin is written by a dedicated thread so that
 * a child that stops reading can only stall that thread, never the caller. Closing the handle stops
 * the process through the supervisor that started it.
 */
public final class ServerProcess implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServerProcess.class);

    static final int MAX_STDERR_LINES = 1000;

    private final Process process;
    private final EntryCommand command;
    private final Path workingDir;
    private final Instant startedAt;
    private final ProcessSupervisor supervisor;
    private final BufferedWriter stdin;
    private final ExecutorService stdinWriter;
    private final BlockingQueue<StdoutLine> stdout = new LinkedBlockingQueue<>();
    private final List<String> stderr = new ArrayList<>();
    private final ReentrantLock exchangeLock = new ReentrantLock(true);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile boolean stdoutClosed = false;

    private record StdoutLine(String text, boolean eof) {
    }

    ServerProcess(Process process, EntryCommand command, Path workingDir, Instant startedAt,
                  ProcessSupervisor supervisor) {
        this.process = process;
        this.command = command;
        this.workingDir = workingDir;
        this.startedAt = startedAt;
        this.supervisor = supervisor;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.stdinWriter = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "mcpprobe-stdin-" + process.pid());
            thread.setDaemon(true);
            return thread;
        });
        startDrainers();
    }

    private void startDrainers() {
        Thread out = new Thread(() -> drainStdout(process.getInputStream()), "mcpprobe-stdout-" + pid());
        out.setDaemon(true);
        out.start();
        Thread err = new Thread(() -> drainStderr(process.getErrorStream()), "mcpprobe-stderr-" + pid());
        err.setDaemon(true);
        err.start();
    }

    private void drainStdout(InputStream in) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                stdout.add(new StdoutLine(line, false));
            }
        } catch (IOException e) {
            log.debug("Stdout of pid {} closed: {}", pid(), e.getMessage());
        } finally {
            stdoutClosed = true;
            stdout.add(new StdoutLine(null, true));
        }
    }

    private void drainStderr(InputStream in) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (stderr) {
                    if (stderr.size() >= MAX_STDERR_LINES) {
                        stderr.remove(0);
                    }
                    stderr.add(line);
                }
            }
        } catch (IOException e) {
            log.debug("Stderr of pid {} closed: {}", pid(), e.getMessage());
        }
    }

    public long pid() {
        return process.pid();
    }

    public @NotNull EntryCommand command() {
        return command;
    }

    public @NotNull Path workingDir() {
        return workingDir;
    }

    public @NotNull Instant startedAt() {
        return startedAt;
    }

    /**
     * Liveness as reported by the operating system
     */
    public boolean isAlive() {
        return process.isAlive();
    }

    public @Nullable Integer exitCode() {
        return process.isAlive() ? null : process.exitValue();
    }

    public ProcessHandle.Info info() {
        return process.info();
    }

    Process process() {
        return process;
    }

    /**
     * Lock that serializes request/response cycles on this process
     */
    public @NotNull ReentrantLock exchangeLock() {
        return exchangeLock;
    }

    /**
     * Write one line to the process's stdin and flush it, waiting at most {@code timeout}.
     * A write that times out stays queued; later writes are ordered behind it.
     *
     * @throws TimeoutException if the child did not take the line in time
     * @throws IOException      if the write failed or stdin is closed
     */
    public void writeLine(@NotNull String line, @NotNull Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        Future<?> write;
        try {
            write = stdinWriter.submit(() -> {
                stdin.write(line);
                stdin.write('\n');
                stdin.flush();
                return null;
            });
        } catch (RejectedExecutionException e) {
            throw new IOException("Stdin of pid " + pid() + " is closed", e);
        }
        try {
            write.get(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new IOException("Writing to pid " + pid() + " failed", e.getCause());
        }
    }

    /**
     * Read the next stdout line.
     *
     * @return the line, or null if none arrived within the timeout
     * @throws EOFException if stdout has been closed
     */
    public @Nullable String readLine(long timeout, @NotNull TimeUnit unit) throws IOException, InterruptedException {
        StdoutLine line = stdout.poll(timeout, unit);
        if (line == null) {
            return null;
        }
        if (line.eof()) {
            // keep the marker for later readers
            stdout.add(line);
            throw new EOFException("Server closed its output stream");
        }
        return line.text();
    }

    public boolean isStdoutClosed() {
        return stdoutClosed;
    }

    /**
     * Snapshot of the stderr lines seen so far
     */
    public List<String> stderrLines() {
        synchronized (stderr) {
            return List.copyOf(stderr);
        }
    }

    /**
     * Lines currently buffered on stdout and not yet read
     */
    public List<String> pendingStdoutLines() {
        List<String> lines = new ArrayList<>();
        for (StdoutLine line : stdout) {
            if (!line.eof()) {
                lines.add(line.text());
            }
        }
        return lines;
    }

    /**
     * Close stdin after any pending writes, waiting at most {@code timeout}.
     *
     * @return false if a stalled write kept stdin open
     */
    boolean closeStdin(Duration timeout) {
        Future<?> close;
        try {
            close = stdinWriter.submit(() -> {
                stdin.close();
                return null;
            });
        } catch (RejectedExecutionException e) {
            return true;
        } finally {
            stdinWriter.shutdown();
        }
        try {
            close.get(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
            return true;
        } catch (ExecutionException e) {
            log.debug("Closing stdin of pid {} failed: {}", pid(), e.getCause().getMessage());
            return true;
        } catch (TimeoutException e) {
            log.debug("Stdin of pid {} is blocked by a pending write", pid());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Mark as stopped, returns false if it already was
     */
    boolean markStopped() {
        return stopped.compareAndSet(false, true);
    }

    public boolean isStopped() {
        return stopped.get();
    }

    @Override
    public void close() {
        supervisor.stop(this);
    }

    @Override
    public String toString() {
        return "ServerProcess[pid=" + pid() + ", command=" + command.display() + "]";
    }
}

package me.bechberger.mcpprobe.process;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Samples memory and CPU usage of a process.
 * Memory comes from {@code /proc/<pid>/status} on Linux and {@code ps} elsewhere,
 * CPU from {@link ProcessHandle.Info#totalCpuDuration()}.
 */
public class ResourceSampler {

    private static final Logger log = LoggerFactory.getLogger(ResourceSampler.class);

    private static final int PS_TIMEOUT_SECONDS = 5;

    public ResourceSample sample(@NotNull ServerProcess process) throws ResourceSampleException {
        if (!process.isAlive()) {
            throw new ResourceSampleException("Process " + process.pid() + " is not running");
        }
        double memoryMb = residentMemoryMb(process.pid());
        double cpuPercent = cpuPercent(process);
        return new ResourceSample(memoryMb, cpuPercent);
    }

    /**
     * Probe bound to the given process
     */
    public ResourceProbe probeFor(@NotNull ServerProcess process) {
        return () -> sample(process);
    }

    /**
     * Take a sample, logging and returning null when the process cannot be sampled
     */
    public static @Nullable ResourceSample sampleOrNull(@NotNull ResourceProbe probe) {
        try {
            return probe.sample();
        } catch (ResourceSampleException e) {
            log.debug("Resource sample unavailable: {}", e.getMessage());
            return null;
        }
    }

    private double residentMemoryMb(long pid) throws ResourceSampleException {
        Path status = Path.of("/proc", String.valueOf(pid), "status");
        if (Files.exists(status)) {
            try {
                List<String> lines = Files.readAllLines(status, StandardCharsets.UTF_8);
                for (String line : lines) {
                    if (line.startsWith("VmRSS:")) {
                        String kb = line.substring("VmRSS:".length()).replace("kB", "").trim();
                        return Long.parseLong(kb) / 1024.0;
                    }
                }
            } catch (IOException | NumberFormatException e) {
                throw new ResourceSampleException("Cannot read " + status, e);
            }
            throw new ResourceSampleException("No VmRSS entry in " + status);
        }
        return residentMemoryFromPs(pid);
    }

    private double residentMemoryFromPs(long pid) throws ResourceSampleException {
        ProcessBuilder pb = new ProcessBuilder("ps", "-o", "rss=", "-p", String.valueOf(pid));
        pb.redirectErrorStream(true);
        try {
            Process ps = pb.start();
            String output;
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(ps.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.readLine();
            }
            if (!ps.waitFor(PS_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                ps.destroyForcibly();
                throw new ResourceSampleException("ps timed out after " + PS_TIMEOUT_SECONDS + " seconds");
            }
            if (ps.exitValue() != 0 || output == null) {
                throw new ResourceSampleException("ps failed for pid " + pid);
            }
            return Long.parseLong(output.trim()) / 1024.0;
        } catch (IOException | NumberFormatException e) {
            throw new ResourceSampleException("Cannot run ps for pid " + pid, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceSampleException("Interrupted while sampling pid " + pid, e);
        }
    }

    private double cpuPercent(ServerProcess process) throws ResourceSampleException {
        Duration cpu = process.info().totalCpuDuration()
                .orElseThrow(() -> new ResourceSampleException("CPU time not available for pid " + process.pid()));
        Duration wall = Duration.between(process.startedAt(), Instant.now());
        if (wall.isZero() || wall.isNegative()) {
            return 0.0;
        }
        return cpu.toNanos() * 100.0 / wall.toNanos();
    }
}

package me.bechberger.mcpprobe.testing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summary of a latency sample in milliseconds.
 * <p>
 * The 95th percentile uses the nearest-rank method, {@code sorted[ceil(0.95 * n) - 1]}, and is
 * reported as at least the mean.
 */
public record LatencyStatistics(double min, double avg, double max, double p95) {

    public static final LatencyStatistics EMPTY = new LatencyStatistics(0, 0, 0, 0);

    public static LatencyStatistics of(List<Double> samples) {
        if (samples.isEmpty()) {
            return EMPTY;
        }
        List<Double> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);
        double sum = 0;
        for (double sample : sorted) {
            sum += sample;
        }
        double min = sorted.get(0);
        double max = sorted.get(sorted.size() - 1);
        // rounding can push the mean just outside [min, max]
        double avg = Math.max(min, Math.min(max, sum / sorted.size()));
        double p95 = Math.max(percentile(sorted, 95), avg);
        return new LatencyStatistics(min, avg, max, p95);
    }

    /**
     * Nearest-rank percentile of a sorted, non-empty list
     */
    static double percentile(List<Double> sorted, double percentile) {
        int index = (int) Math.ceil(sorted.size() * percentile / 100.0) - 1;
        index = Math.max(0, Math.min(index, sorted.size() - 1));
        return sorted.get(index);
    }
}

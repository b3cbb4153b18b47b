package me.bechberger.mcpprobe.config;

import java.time.Duration;

/**
 * Parses duration strings like "3s", "500ms" or "1m"; a bare number means seconds.
 */
public final class Durations {

    private Durations() {
    }

    /**
     * @throws IllegalArgumentException if the string is not a positive duration
     */
    public static Duration parse(String durationStr) {
        if (durationStr == null || durationStr.isBlank()) {
            throw new IllegalArgumentException("Empty duration");
        }
        String text = durationStr.toLowerCase().trim();
        Duration duration;
        try {
            if (text.endsWith("ms")) {
                duration = Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2)));
            } else if (text.endsWith("s")) {
                duration = Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1)));
            } else if (text.endsWith("m")) {
                duration = Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1)));
            } else {
                duration = Duration.ofSeconds(Long.parseLong(text));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration: " + durationStr, e);
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Duration must be positive: " + durationStr);
        }
        return duration;
    }
}

package me.bechberger.mcpprobe.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationsTest {

    @Test
    void units() {
        assertEquals(Duration.ofMillis(500), Durations.parse("500ms"));
        assertEquals(Duration.ofSeconds(30), Durations.parse("30s"));
        assertEquals(Duration.ofMinutes(2), Durations.parse("2m"));
        assertEquals(Duration.ofSeconds(15), Durations.parse("15"));
        assertEquals(Duration.ofSeconds(3), Durations.parse(" 3S "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "0s", "-5", "1.5s", "10h"})
    void invalid(String text) {
        assertThrows(IllegalArgumentException.class, () -> Durations.parse(text));
    }
}

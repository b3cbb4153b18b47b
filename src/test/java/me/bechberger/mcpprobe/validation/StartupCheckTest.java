package me.bechberger.mcpprobe.validation;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StartupCheckTest {

    @Test
    void stderrLinesAreSplitByErrorMarkers() {
        List<String> errors = new ArrayList<>();
        List<String> logs = new ArrayList<>();

        StartupCheck.classifyStderr(List.of(
                "Server listening on stdio",
                "Traceback (most recent call last):",
                "WARNING: deprecated option",
                "Exception in thread main: boom"), errors, logs);

        assertEquals(List.of("Traceback (most recent call last):", "Exception in thread main: boom"), errors);
        assertEquals(List.of("Server listening on stdio", "WARNING: deprecated option"), logs);
    }
}

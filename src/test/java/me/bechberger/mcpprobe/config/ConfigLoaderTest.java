package me.bechberger.mcpprobe.config;

import me.bechberger.mcpprobe.model.ValidationLevel;
import me.bechberger.mcpprobe.testing.TestOptions;
import me.bechberger.mcpprobe.validation.ValidationOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void yamlConfigAppliesToBothOptionSets() throws IOException {
        ProbeConfig config = ConfigLoader.load(write("mcpprobe.yaml", """
                level: comprehensive
                entryCommand: node build/index.js --stdio
                startupTimeout: 45s
                requestTimeout: 500ms
                keepGoing: true
                baselineCapabilities: [initialize, tools/list]
                maxWorkers: 8
                loadUserLevels: [1, 2]
                includeSecurity: false
                """));

        ValidationOptions validation = config.applyTo(ValidationOptions.builder()).build();
        TestOptions testing = config.applyTo(TestOptions.builder()).build();

        assertTrue(config.isKeepGoing());
        assertEquals(ValidationLevel.COMPREHENSIVE, validation.getLevel());
        assertEquals(List.of("node", "build/index.js", "--stdio"), validation.getEntryCommand().argv());
        assertEquals(Duration.ofSeconds(45), validation.getStartupTimeout());
        assertEquals(Duration.ofMillis(500), validation.getRequestTimeout());
        assertEquals(List.of("initialize", "tools/list"), validation.getBaselineCapabilities());
        assertEquals(8, testing.getMaxWorkers());
        assertEquals(List.of(1, 2), testing.getLoadUserLevels());
        assertFalse(testing.isIncludeSecurity());
        assertTrue(testing.isIncludePerformance());
        assertEquals(Duration.ofMillis(500), testing.getRequestTimeout());
    }

    @Test
    void jsonIsAccepted() throws IOException {
        ProbeConfig config = ConfigLoader.load(write("mcpprobe.json", "{\"level\": \"basic\", \"requestsPerUser\": 7}"));

        assertEquals("basic", config.level());
        assertEquals(7, config.requestsPerUser());
        assertFalse(config.isKeepGoing());
    }

    @Test
    void absentFieldsKeepDefaults() throws IOException {
        ProbeConfig config = ConfigLoader.load(write("empty.yaml", ""));

        assertSame(ProbeConfig.EMPTY, config);
        ValidationOptions options = config.applyTo(ValidationOptions.builder()).build();
        assertEquals(ValidationLevel.STANDARD, options.getLevel());
        assertEquals(ValidationOptions.DEFAULT_BASELINE, options.getBaselineCapabilities());
    }

    @Test
    void unknownFieldIsAnError() throws IOException {
        Path file = write("bad.yaml", "levle: basic\n");

        assertThrows(IOException.class, () -> ConfigLoader.load(file));
    }

    @Test
    void missingFileIsAnError() {
        IOException e = assertThrows(IOException.class, () -> ConfigLoader.load(dir.resolve("nope.yaml")));
        assertTrue(e.getMessage().startsWith("Config file not found"));
    }

    @Test
    void invalidValuesFailWhenApplied() throws IOException {
        ProbeConfig config = ConfigLoader.load(write("invalid.yaml", "level: extreme\nstartupTimeout: soon\n"));

        assertThrows(IllegalArgumentException.class, () -> config.applyTo(ValidationOptions.builder()));
    }
}

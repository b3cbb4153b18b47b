package me.bechberger.mcpprobe.process;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EntryPointDetectorTest {

    @TempDir
    Path project;

    private final EntryPointDetector detector = new EntryPointDetector();

    @Test
    void emptyProject_hasNoEntryPoint() {
        assertTrue(detector.detect(project).isEmpty());
    }

    @Test
    void pythonEntryFiles_winInOrder() throws IOException {
        Files.writeString(project.resolve("app.py"), "");
        Files.writeString(project.resolve("server.py"), "");
        Files.writeString(project.resolve("package.json"), "{\"scripts\": {\"start\": \"node index.js\"}}");

        EntryCommand command = detector.detect(project).orElseThrow();

        assertEquals(List.of("python", "server.py"), command.argv());
        assertEquals("server.py", command.source());
    }

    @Test
    void packageJsonStartScript_isPreferredOverMain() throws IOException {
        Files.writeString(project.resolve("package.json"), "{\"main\": \"index.js\", \"scripts\": {\"start\": \"node index.js\"}}");

        assertEquals(List.of("npm", "start"), detector.detect(project).orElseThrow().argv());
    }

    @Test
    void packageJsonMain_runsWithNode() throws IOException {
        Files.writeString(project.resolve("package.json"), "{\"main\": \"dist/index.js\"}");

        assertEquals(List.of("node", "dist/index.js"), detector.detect(project).orElseThrow().argv());
    }

    @Test
    void unparsablePackageJson_fallsThroughToPyproject() throws IOException {
        Files.writeString(project.resolve("package.json"), "{ not json");
        Files.writeString(project.resolve("pyproject.toml"), "[tool.poetry]\nname = \"x\"\n");

        Optional<EntryCommand> command = detector.detect(project);

        assertTrue(command.isPresent());
        assertEquals("poetry", command.get().argv().get(0));
    }
}

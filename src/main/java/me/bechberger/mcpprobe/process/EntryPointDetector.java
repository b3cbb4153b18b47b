package me.bechberger.mcpprobe.process;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Detects how to launch a server project from the files in its root directory.
 * <p>
 * Order: {@code main.py}, {@code server.py}, {@code app.py}, then {@code package.json}
 * (start script before main entry), then {@code pyproject.toml}.
 */
public class EntryPointDetector {

    private static final Logger log = LoggerFactory.getLogger(EntryPointDetector.class);

    private static final List<String> PYTHON_ENTRY_FILES = List.of("main.py", "server.py", "app.py");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public Optional<EntryCommand> detect(@NotNull Path projectPath) {
        for (String file : PYTHON_ENTRY_FILES) {
            if (Files.isRegularFile(projectPath.resolve(file))) {
                return Optional.of(EntryCommand.of(file, "python", file));
            }
        }

        Path packageJson = projectPath.resolve("package.json");
        if (Files.isRegularFile(packageJson)) {
            Optional<EntryCommand> node = detectNode(packageJson);
            if (node.isPresent()) {
                return node;
            }
        }

        if (Files.isRegularFile(projectPath.resolve("pyproject.toml"))) {
            return Optional.of(EntryCommand.of("pyproject.toml", "poetry", "run", "python", "-m", "server"));
        }

        return Optional.empty();
    }

    private Optional<EntryCommand> detectNode(Path packageJson) {
        JsonNode root;
        try {
            root = MAPPER.readTree(packageJson.toFile());
        } catch (IOException e) {
            log.warn("Could not parse {}: {}", packageJson, e.getMessage());
            return Optional.empty();
        }
        if (root.path("scripts").hasNonNull("start")) {
            return Optional.of(EntryCommand.of("package.json start script", "npm", "start"));
        }
        String main = root.path("main").asText("");
        if (!main.isEmpty()) {
            return Optional.of(EntryCommand.of("package.json main", "node", main));
        }
        return Optional.empty();
    }
}

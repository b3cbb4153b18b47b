package me.bechberger.mcpprobe.security;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Files of a project as seen by the scan passes, in sorted order, plus the warnings collected
 * for files that could not be read.
 */
public class ScanContext {

    private static final Logger log = LoggerFactory.getLogger(ScanContext.class);

    private final Path root;
    private final List<Path> files;
    private final List<String> warnings = new ArrayList<>();

    /**
     * @param files paths relative to {@code root}, sorted
     */
    public ScanContext(@NotNull Path root, @NotNull List<Path> files) {
        this.root = root;
        this.files = List.copyOf(files);
    }

    public @NotNull Path root() {
        return root;
    }

    public @NotNull List<Path> files() {
        return files;
    }

    /**
     * Files whose name ends with one of the suffixes
     */
    public List<Path> filesEndingWith(String... suffixes) {
        List<Path> matching = new ArrayList<>();
        for (Path file : files) {
            String name = file.getFileName().toString();
            for (String suffix : suffixes) {
                if (name.endsWith(suffix)) {
                    matching.add(file);
                    break;
                }
            }
        }
        return matching;
    }

    /**
     * Lines of a file, or empty with a warning recorded if it cannot be read as UTF-8 text
     */
    public Optional<List<String>> readLines(@NotNull Path relative) {
        try {
            return Optional.of(Files.readAllLines(root.resolve(relative), StandardCharsets.UTF_8));
        } catch (MalformedInputException e) {
            warn("Skipped non-UTF-8 file " + display(relative));
            return Optional.empty();
        } catch (IOException e) {
            warn("Could not read " + display(relative) + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<String> readString(@NotNull Path relative) {
        return readLines(relative).map(lines -> String.join("\n", lines));
    }

    public void warn(@NotNull String warning) {
        log.warn(warning);
        warnings.add(warning);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    /**
     * Relative path with forward slashes, as used in issues
     */
    public static String display(Path relative) {
        return relative.toString().replace('\\', '/');
    }
}

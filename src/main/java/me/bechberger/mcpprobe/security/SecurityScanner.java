package me.bechberger.mcpprobe.security;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Static security scan of a project directory.
 * <p>
 * Runs its passes in registration order over the same sorted file list. Reading is the only
 * file system access, so scanning the same tree twice gives the same result.
 */
public class SecurityScanner {

    private static final Logger log = LoggerFactory.getLogger(SecurityScanner.class);

    static final Set<String> SKIPPED_DIRECTORIES = Set.of(
            "node_modules", ".git", "venv", ".venv", "__pycache__", "dist", "build", "target");

    private final List<ScanPass> passes;

    public SecurityScanner(@NotNull List<ScanPass> passes) {
        this.passes = List.copyOf(passes);
    }

    /**
     * Scanner with the dependency, code and configuration passes
     */
    public static SecurityScanner createDefault() {
        return new SecurityScanner(List.of(new DependencyScanPass(), new CodeScanPass(), new ConfigurationScanPass()));
    }

    public @NotNull SecurityScanResult scan(@NotNull Path projectPath) {
        long start = System.nanoTime();
        Path root = projectPath.toAbsolutePath().normalize();
        List<String> walkWarnings = new ArrayList<>();
        List<Path> files = List.of();
        if (!Files.isDirectory(root)) {
            walkWarnings.add("Project directory does not exist: " + root);
        } else {
            try {
                files = listFiles(root);
            } catch (IOException | UncheckedIOException e) {
                walkWarnings.add("Could not list files of " + root + ": " + e.getMessage());
            }
        }

        ScanContext context = new ScanContext(root, files);
        List<SecurityIssue> issues = new ArrayList<>();
        Set<String> recommendations = new LinkedHashSet<>();
        if (!files.isEmpty()) {
            for (ScanPass pass : passes) {
                PassResult result = pass.scan(context);
                log.debug("Pass {} found {} issues", pass.getName(), result.issues().size());
                issues.addAll(result.issues());
                recommendations.addAll(result.recommendations());
            }
        }

        List<String> warnings = new ArrayList<>(walkWarnings);
        warnings.addAll(context.warnings());
        double seconds = (System.nanoTime() - start) / 1e9;
        return new SecurityScanResult(root.toString(), countBySeverity(issues), issues, files.size(), warnings,
                List.copyOf(recommendations), seconds);
    }

    private static List<Path> listFiles(Path root) throws IOException {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                    .filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(SecurityScanner::notInSkippedDirectory)
                    .sorted(Comparator.comparing(ScanContext::display))
                    .toList();
        }
    }

    private static boolean notInSkippedDirectory(Path relative) {
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (SKIPPED_DIRECTORIES.contains(relative.getName(i).toString())) {
                return false;
            }
        }
        return true;
    }

    private static Map<ScanCategory, Map<IssueSeverity, Integer>> countBySeverity(List<SecurityIssue> issues) {
        Map<ScanCategory, Map<IssueSeverity, Integer>> counts = new EnumMap<>(ScanCategory.class);
        for (ScanCategory category : ScanCategory.values()) {
            Map<IssueSeverity, Integer> bySeverity = new EnumMap<>(IssueSeverity.class);
            for (IssueSeverity severity : IssueSeverity.values()) {
                bySeverity.put(severity, 0);
            }
            counts.put(category, bySeverity);
        }
        for (SecurityIssue issue : issues) {
            counts.get(issue.category()).merge(issue.severity(), 1, Integer::sum);
        }
        return counts;
    }
}

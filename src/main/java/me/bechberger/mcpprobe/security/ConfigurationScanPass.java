package me.bechberger.mcpprobe.security;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Looks for sensitive files, an incomplete {@code .gitignore} and world-writable scripts.
 */
public class ConfigurationScanPass implements ScanPass {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationScanPass.class);

    private static final Map<String, IssueSeverity> SENSITIVE_FILES = Map.of(
            ".env", IssueSeverity.HIGH,
            ".env.local", IssueSeverity.HIGH,
            "config.json", IssueSeverity.MEDIUM,
            "secrets.json", IssueSeverity.CRITICAL,
            "private.key", IssueSeverity.CRITICAL,
            "id_rsa", IssueSeverity.CRITICAL
    );

    static final List<String> REQUIRED_IGNORES = List.of(".env", "*.key", "secrets.*", "config.json");

    @Override
    public @NotNull String getName() {
        return "configuration";
    }

    @Override
    public @NotNull ScanCategory getCategory() {
        return ScanCategory.CONFIGURATION;
    }

    @Override
    public @NotNull PassResult scan(@NotNull ScanContext context) {
        List<SecurityIssue> issues = new ArrayList<>();
        for (Path file : context.files()) {
            IssueSeverity severity = SENSITIVE_FILES.get(file.getFileName().toString());
            if (severity != null) {
                issues.add(issue("sensitive_file", file, "Sensitive file " + file.getFileName()
                        + " is part of the project and may contain credentials", severity));
            }
        }
        checkGitignore(context, issues);
        checkPermissions(context, issues);

        List<String> recommendations = issues.isEmpty()
                ? List.of()
                : List.of("Secure sensitive configuration files and credentials");
        return new PassResult(issues, recommendations);
    }

    private void checkGitignore(ScanContext context, List<SecurityIssue> issues) {
        Path gitignore = Path.of(".gitignore");
        if (!Files.isRegularFile(context.root().resolve(gitignore))) {
            issues.add(issue("missing_gitignore", gitignore,
                    "No .gitignore file; sensitive files may be committed", IssueSeverity.MEDIUM));
            return;
        }
        context.readLines(gitignore).ifPresent(lines -> {
            List<String> entries = lines.stream().map(String::trim).toList();
            for (String required : REQUIRED_IGNORES) {
                if (!entries.contains(required)) {
                    issues.add(issue("gitignore_incomplete", gitignore,
                            ".gitignore does not exclude " + required, IssueSeverity.LOW));
                }
            }
        });
    }

    private void checkPermissions(ScanContext context, List<SecurityIssue> issues) {
        for (Path file : context.filesEndingWith(".sh", ".py")) {
            Set<PosixFilePermission> permissions;
            try {
                permissions = Files.getPosixFilePermissions(context.root().resolve(file));
            } catch (UnsupportedOperationException e) {
                log.debug("File system does not support POSIX permissions, skipping permission checks");
                return;
            } catch (IOException e) {
                context.warn("Could not read permissions of " + ScanContext.display(file) + ": " + e.getMessage());
                continue;
            }
            if (permissions.contains(PosixFilePermission.OTHERS_WRITE)) {
                issues.add(issue("insecure_permissions", file,
                        "File is world-writable", IssueSeverity.MEDIUM));
            }
        }
    }

    private static SecurityIssue issue(String type, Path file, String description, IssueSeverity severity) {
        return new SecurityIssue(type, ScanCategory.CONFIGURATION, ScanContext.display(file), 0, description, severity);
    }
}

package me.bechberger.mcpprobe.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.bechberger.mcpprobe.security.VulnerablePackage.Ecosystem;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compares declared dependencies against a table of known vulnerable version ranges.
 * Reads {@code requirements*.txt}, {@code pyproject.toml} and {@code package.json}.
 */
public class DependencyScanPass implements ScanPass {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Pattern REQUIREMENT = Pattern.compile(
            "^\\s*([A-Za-z0-9][A-Za-z0-9_.\\-]*)\\s*(\\[[^]]*])?\\s*(.*)$");
    private static final Pattern VERSION = Pattern.compile("\\d+(?:\\.\\d+)*");
    private static final Pattern POETRY_DEPENDENCY = Pattern.compile(
            "^\\s*([A-Za-z0-9][A-Za-z0-9_.\\-]*)\\s*=\\s*(?:\"([^\"]*)\"|\\{.*?version\\s*=\\s*\"([^\"]*)\".*})");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"|'([^']+)'");
    private static final Pattern ARRAY_START = Pattern.compile("^\\s*[A-Za-z0-9_\\-]+\\s*=\\s*\\[");

    private final List<VulnerablePackage> table;

    public DependencyScanPass() {
        this(VulnerablePackage.KNOWN);
    }

    public DependencyScanPass(@NotNull List<VulnerablePackage> table) {
        this.table = List.copyOf(table);
    }

    @Override
    public @NotNull String getName() {
        return "dependencies";
    }

    @Override
    public @NotNull ScanCategory getCategory() {
        return ScanCategory.DEPENDENCY;
    }

    @Override
    public @NotNull PassResult scan(@NotNull ScanContext context) {
        List<SecurityIssue> issues = new ArrayList<>();
        for (Path file : context.files()) {
            String name = file.getFileName().toString();
            if (name.startsWith("requirements") && name.endsWith(".txt")) {
                context.readLines(file).ifPresent(lines -> scanRequirements(file, lines, issues));
            } else if (name.equals("pyproject.toml")) {
                context.readLines(file).ifPresent(lines -> scanPyproject(file, lines, issues));
            } else if (name.equals("package.json")) {
                context.readString(file).ifPresent(text -> scanPackageJson(context, file, text, issues));
            }
        }
        List<String> recommendations = issues.isEmpty()
                ? List.of()
                : List.of("Update vulnerable dependencies to latest secure versions");
        return new PassResult(issues, recommendations);
    }

    private void scanRequirements(Path file, List<String> lines, List<SecurityIssue> issues) {
        for (int i = 0; i < lines.size(); i++) {
            String line = stripComment(lines.get(i));
            if (line.isBlank() || line.startsWith("-")) {
                continue;
            }
            Matcher m = REQUIREMENT.matcher(line);
            if (m.matches()) {
                check(Ecosystem.PYPI, m.group(1), m.group(3), file, i + 1, issues);
            }
        }
    }

    private void scanPyproject(Path file, List<String> lines, List<SecurityIssue> issues) {
        String section = "";
        boolean inArray = false;
        for (int i = 0; i < lines.size(); i++) {
            String line = stripComment(lines.get(i));
            String trimmed = line.trim();
            if (!inArray && trimmed.startsWith("[") && trimmed.endsWith("]")) {
                section = trimmed;
                continue;
            }
            boolean dependencySection = section.contains("dependencies");
            boolean projectSection = section.equals("[project]");
            if (!inArray && ARRAY_START.matcher(line).find()
                    && (dependencySection || (projectSection && trimmed.startsWith("dependencies")))) {
                inArray = true;
                line = line.substring(line.indexOf('[') + 1);
            }
            if (inArray) {
                Matcher quoted = QUOTED.matcher(line);
                while (quoted.find()) {
                    String versionSpec = quoted.group(1) != null ? quoted.group(1) : quoted.group(2);
                    Matcher m = REQUIREMENT.matcher(versionSpec);
                    if (m.matches()) {
                        check(Ecosystem.PYPI, m.group(1), m.group(3), file, i + 1, issues);
                    }
                }
                // a bracket outside quotes closes the array
                if (QUOTED.matcher(line).replaceAll("").contains("]")) {
                    inArray = false;
                }
                continue;
            }
            if (dependencySection) {
                Matcher m = POETRY_DEPENDENCY.matcher(line);
                if (m.find() && !m.group(1).equalsIgnoreCase("python")) {
                    String versionSpec = m.group(2) != null ? m.group(2) : m.group(3);
                    check(Ecosystem.PYPI, m.group(1), versionSpec, file, i + 1, issues);
                }
            }
        }
    }

    private void scanPackageJson(ScanContext context, Path file, String text, List<SecurityIssue> issues) {
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            context.warn("Could not parse " + ScanContext.display(file) + ": " + e.getOriginalMessage());
            return;
        }
        for (String section : List.of("dependencies", "devDependencies")) {
            JsonNode deps = root.path(section);
            Iterator<Map.Entry<String, JsonNode>> fields = deps.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                check(Ecosystem.NPM, entry.getKey(), entry.getValue().asText(""), file, 0, issues);
            }
        }
    }

    private void check(Ecosystem ecosystem, String packageName, @Nullable String versionSpec, Path file, int line,
                       List<SecurityIssue> issues) {
        for (VulnerablePackage vulnerable : table) {
            if (!vulnerable.matches(ecosystem, packageName)) {
                continue;
            }
            Optional<String> version = lowerBound(versionSpec);
            if (version.isEmpty()) {
                issues.add(issue(vulnerable, file, line, vulnerable.description() + " (version not pinned)"));
            } else if (vulnerable.isVulnerable(version.get())) {
                issues.add(issue(vulnerable, file, line,
                        vulnerable.description() + " (declared " + version.get() + ", fixed in " + vulnerable.fixedVersion() + ")"));
            }
        }
    }

    /**
     * The lowest version a specifier admits, empty for unpinned or upper-bound-only specifiers
     */
    static Optional<String> lowerBound(@Nullable String versionSpec) {
        if (versionSpec == null) {
            return Optional.empty();
        }
        String trimmed = versionSpec.trim();
        if (trimmed.isEmpty() || trimmed.equals("*") || trimmed.startsWith("<")) {
            return Optional.empty();
        }
        // only the first clause of e.g. ">=1.0,<2.0" bounds from below
        String first = trimmed.split("[,;|]")[0];
        Matcher m = VERSION.matcher(first);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    private SecurityIssue issue(VulnerablePackage vulnerable, Path file, int line, String description) {
        return new SecurityIssue("vulnerable_dependency", ScanCategory.DEPENDENCY, ScanContext.display(file), line,
                vulnerable.name() + ": " + description, vulnerable.severity());
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }
}

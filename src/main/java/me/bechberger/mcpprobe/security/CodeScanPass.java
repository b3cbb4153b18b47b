package me.bechberger.mcpprobe.security;

import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Line-based search for dangerous calls and hard-coded credentials in Python and JavaScript/TypeScript sources.
 */
public class CodeScanPass implements ScanPass {

    enum Language {
        PYTHON("#", ".py"),
        JAVASCRIPT("//", ".js", ".mjs", ".cjs", ".ts");

        final String commentPrefix;
        final List<String> extensions;

        Language(String commentPrefix, String... extensions) {
            this.commentPrefix = commentPrefix;
            this.extensions = List.of(extensions);
        }

        static Language of(Path file) {
            String name = file.getFileName().toString();
            for (Language language : values()) {
                for (String extension : language.extensions) {
                    if (name.endsWith(extension)) {
                        return language;
                    }
                }
            }
            return null;
        }
    }

    /**
     * A pattern and the finding it produces
     */
    record CodePattern(String type, Pattern pattern, IssueSeverity severity, String description, Set<Language> languages) {
    }

    private static final Set<Language> PY = EnumSet.of(Language.PYTHON);
    private static final Set<Language> JS = EnumSet.of(Language.JAVASCRIPT);
    private static final Set<Language> ALL = EnumSet.allOf(Language.class);

    static final List<CodePattern> PATTERNS = List.of(
            new CodePattern("code_injection", Pattern.compile("(?<![\\w.])eval\\s*\\("), IssueSeverity.CRITICAL,
                    "Use of eval() can execute arbitrary code", PY),
            new CodePattern("code_injection", Pattern.compile("(?<![\\w.])exec\\s*\\("), IssueSeverity.CRITICAL,
                    "Use of exec() can execute arbitrary code", PY),
            new CodePattern("shell_injection", Pattern.compile("subprocess\\.\\w+\\s*\\(.*shell\\s*=\\s*True"), IssueSeverity.HIGH,
                    "Subprocess call with shell=True may allow shell injection", PY),
            new CodePattern("shell_injection", Pattern.compile("os\\.system\\s*\\("), IssueSeverity.HIGH,
                    "os.system() passes its argument to the shell", PY),
            new CodePattern("shell_injection", Pattern.compile("os\\.popen\\s*\\("), IssueSeverity.HIGH,
                    "os.popen() passes its argument to the shell", PY),
            new CodePattern("unsafe_deserialization", Pattern.compile("pickle\\.loads?\\s*\\("), IssueSeverity.HIGH,
                    "Unpickling untrusted data can execute arbitrary code", PY),
            new CodePattern("unsafe_deserialization", Pattern.compile("yaml\\.load\\s*\\((?!.*SafeLoader)"), IssueSeverity.MEDIUM,
                    "yaml.load() without SafeLoader can construct arbitrary objects", PY),
            new CodePattern("unvalidated_input", Pattern.compile("(?<![\\w.])input\\s*\\("), IssueSeverity.LOW,
                    "input() reads unvalidated user input", PY),
            new CodePattern("code_injection", Pattern.compile("(?<![\\w.$])eval\\s*\\("), IssueSeverity.CRITICAL,
                    "Use of eval() can execute arbitrary code", JS),
            new CodePattern("code_injection", Pattern.compile("new\\s+Function\\s*\\("), IssueSeverity.CRITICAL,
                    "new Function() compiles arbitrary code", JS),
            new CodePattern("shell_injection", Pattern.compile("(?:child_process\\.|(?<![\\w.$]))exec(?:Sync)?\\s*\\("), IssueSeverity.HIGH,
                    "exec() runs its argument through the shell", JS),
            new CodePattern("shell_injection", Pattern.compile("shell\\s*:\\s*true"), IssueSeverity.HIGH,
                    "Spawning a process with shell: true may allow shell injection", JS),
            new CodePattern("xss", Pattern.compile("\\.innerHTML\\s*="), IssueSeverity.MEDIUM,
                    "Assigning innerHTML may allow cross-site scripting", JS),
            new CodePattern("xss", Pattern.compile("document\\.write\\s*\\("), IssueSeverity.MEDIUM,
                    "document.write() may allow cross-site scripting", JS),
            new CodePattern("hardcoded_secret",
                    Pattern.compile("(?i)(?<![A-Za-z0-9])(password|passwd|api_key|apikey|secret|token)\\b[\"']?\\s*[:=]\\s*[\"'][^\"']+[\"']"),
                    IssueSeverity.MEDIUM, "Possible hard-coded credential", ALL)
    );

    @Override
    public @NotNull String getName() {
        return "code";
    }

    @Override
    public @NotNull ScanCategory getCategory() {
        return ScanCategory.CODE;
    }

    @Override
    public @NotNull PassResult scan(@NotNull ScanContext context) {
        List<SecurityIssue> issues = new ArrayList<>();
        for (Path file : context.files()) {
            Language language = Language.of(file);
            if (language == null) {
                continue;
            }
            context.readLines(file).ifPresent(lines -> scanFile(file, language, lines, issues));
        }
        return new PassResult(issues, recommendations(issues));
    }

    private void scanFile(Path file, Language language, List<String> lines, List<SecurityIssue> issues) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.trim().startsWith(language.commentPrefix)) {
                continue;
            }
            for (CodePattern pattern : PATTERNS) {
                if (pattern.languages().contains(language) && pattern.pattern().matcher(line).find()) {
                    issues.add(new SecurityIssue(pattern.type(), ScanCategory.CODE, ScanContext.display(file), i + 1,
                            pattern.description(), pattern.severity()));
                }
            }
        }
    }

    private static List<String> recommendations(List<SecurityIssue> issues) {
        List<String> recommendations = new ArrayList<>();
        if (issues.stream().anyMatch(i -> i.severity() == IssueSeverity.CRITICAL)) {
            recommendations.add("Fix critical security vulnerabilities immediately");
        }
        if (issues.stream().anyMatch(i -> i.severity() == IssueSeverity.HIGH)) {
            recommendations.add("Address high-severity security issues");
        }
        if (issues.stream().anyMatch(i -> i.severity() == IssueSeverity.MEDIUM)) {
            recommendations.add("Review and fix medium-severity security issues");
        }
        return recommendations;
    }
}

package me.bechberger.mcpprobe.security;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A package whose versions below {@code fixedVersion} have known vulnerabilities.
 */
public record VulnerablePackage(
        Ecosystem ecosystem,
        String name,
        String fixedVersion,
        IssueSeverity severity,
        String description
) {

    public enum Ecosystem {
        PYPI,
        NPM
    }

    /** Known vulnerable ranges checked by default */
    public static final List<VulnerablePackage> KNOWN = List.of(
            new VulnerablePackage(Ecosystem.PYPI, "requests", "2.20.0", IssueSeverity.MEDIUM,
                    "requests before 2.20.0 leaks credentials on redirects (CVE-2018-18074)"),
            new VulnerablePackage(Ecosystem.PYPI, "flask", "1.0", IssueSeverity.HIGH,
                    "Flask before 1.0 is vulnerable to denial of service via crafted JSON (CVE-2018-1000656)"),
            new VulnerablePackage(Ecosystem.PYPI, "django", "3.2", IssueSeverity.HIGH,
                    "Django before 3.2 is no longer supported and has unpatched vulnerabilities"),
            new VulnerablePackage(Ecosystem.PYPI, "pyyaml", "5.4", IssueSeverity.MEDIUM,
                    "PyYAML before 5.4 allows arbitrary code execution via full_load (CVE-2020-14343)"),
            new VulnerablePackage(Ecosystem.NPM, "lodash", "4.17.21", IssueSeverity.MEDIUM,
                    "lodash before 4.17.21 is vulnerable to command injection via template (CVE-2021-23337)"),
            new VulnerablePackage(Ecosystem.NPM, "minimist", "1.2.6", IssueSeverity.MEDIUM,
                    "minimist before 1.2.6 is vulnerable to prototype pollution (CVE-2021-44906)")
    );

    public boolean matches(@NotNull Ecosystem ecosystem, @NotNull String packageName) {
        return this.ecosystem == ecosystem && name.equals(normalize(packageName));
    }

    /**
     * Whether the given version is below the fixed version
     */
    public boolean isVulnerable(@NotNull String version) {
        return compareVersions(version, fixedVersion) < 0;
    }

    /**
     * Lower-case, with underscores and dots treated as dashes as pip does
     */
    public static String normalize(String packageName) {
        return packageName.trim().toLowerCase().replace('_', '-').replace('.', '-');
    }

    /**
     * Numeric comparison of dotted versions; non-numeric parts count as 0, missing parts as 0.
     */
    static int compareVersions(String a, String b) {
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        for (int i = 0; i < Math.max(left.length, right.length); i++) {
            int l = i < left.length ? numericPrefix(left[i]) : 0;
            int r = i < right.length ? numericPrefix(right[i]) : 0;
            if (l != r) {
                return Integer.compare(l, r);
            }
        }
        return 0;
    }

    private static int numericPrefix(String part) {
        int end = 0;
        while (end < part.length() && Character.isDigit(part.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return 0;
        }
        try {
            return Integer.parseInt(part.substring(0, end));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}

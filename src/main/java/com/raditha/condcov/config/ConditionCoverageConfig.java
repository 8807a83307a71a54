package com.raditha.condcov.config;

import com.raditha.condcov.report.SeverityThresholds;

import java.nio.file.Path;
import java.util.List;

/**
 * Settings for one analysis run. Built once and passed to the components that
 * need it; nothing reads configuration from global state.
 *
 * @param sourceRoot      directory whose {@code .java} files are analyzed
 * @param coverageReport  JaCoCo XML report or JSON line map with executed lines
 * @param reportDirectory where the JSON and HTML reports are written
 * @param thresholds      severity tiers for the rendered reports
 * @param excludePatterns glob patterns of source paths to skip
 * @param parallelism     number of files analyzed concurrently
 * @param failUnder       minimum total coverage percentage, 0 to disable the check
 */
public record ConditionCoverageConfig(
        Path sourceRoot,
        Path coverageReport,
        Path reportDirectory,
        SeverityThresholds thresholds,
        List<String> excludePatterns,
        int parallelism,
        double failUnder) {

    public static final Path DEFAULT_COVERAGE_REPORT = Path.of("target", "site", "jacoco", "jacoco.xml");
    public static final Path DEFAULT_REPORT_DIRECTORY = Path.of("condcov-report");

    /**
     * Validate configuration.
     */
    public ConditionCoverageConfig {
        if (sourceRoot == null) {
            throw new IllegalArgumentException("sourceRoot cannot be null");
        }
        if (coverageReport == null) {
            throw new IllegalArgumentException("coverageReport cannot be null");
        }
        if (reportDirectory == null) {
            reportDirectory = DEFAULT_REPORT_DIRECTORY;
        }
        if (thresholds == null) {
            thresholds = SeverityThresholds.defaults();
        }
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        if (failUnder < 0.0 || failUnder > 100.0) {
            throw new IllegalArgumentException("failUnder must be between 0 and 100");
        }
    }

    /**
     * Configuration with defaults for everything except the source root.
     */
    public static ConditionCoverageConfig defaults(Path sourceRoot) {
        return new ConditionCoverageConfig(
                sourceRoot,
                DEFAULT_COVERAGE_REPORT,
                DEFAULT_REPORT_DIRECTORY,
                SeverityThresholds.defaults(),
                defaultExcludePatterns(),
                1,
                0.0);
    }

    /**
     * Default file exclusion patterns.
     */
    public static List<String> defaultExcludePatterns() {
        return List.of(
                "**/target/**",
                "**/build/**",
                "**/.git/**");
    }

    public boolean isFailUnderEnabled() {
        return failUnder > 0.0;
    }

    /**
     * Check if a source path matches any exclusion pattern.
     *
     * @param relativePath path relative to the source root, with forward slashes
     */
    public boolean shouldExclude(String relativePath) {
        String path = relativePath.replace('\\', '/');
        for (String pattern : excludePatterns) {
            if (path.matches(globToRegex(pattern))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Glob to regex. Supports {@code **}, {@code *} and {@code ?}.
     * {@code **}{@code /} also matches zero directories.
     */
    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (glob.startsWith("**/", i)) {
                regex.append("(?:.*/)?");
                i += 3;
                continue;
            }
            if (c == '*' && i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                regex.append(".*");
                i += 2;
                continue;
            }
            switch (c) {
                case '*' -> regex.append("[^/]*");
                case '?' -> regex.append("[^/]");
                case '.', '(', ')', '+', '|', '^', '$', '@', '%', '{', '}', '[', ']', '\\' ->
                        regex.append('\\').append(c);
                default -> regex.append(c);
            }
            i++;
        }
        return regex.toString();
    }
}

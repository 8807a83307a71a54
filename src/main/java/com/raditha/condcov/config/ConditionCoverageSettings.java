package com.raditha.condcov.config;

import com.raditha.condcov.report.SeverityThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads {@link ConditionCoverageConfig} from the {@code condition_coverage}
 * section of a YAML file, with command-line overrides.
 * <p>
 * Configuration priority: CLI arguments &gt; YAML &gt; defaults
 * <pre>
 * condition_coverage:
 *   source_root: src/main/java
 *   coverage_report: target/site/jacoco/jacoco.xml
 *   report_directory: target/condcov
 *   thresholds:
 *     good: 80
 *     warning: 60
 *   exclude_patterns:
 *     - "**&#47;generated/**"
 *   parallelism: 4
 *   fail_under: 75
 * </pre>
 */
public class ConditionCoverageSettings {

    private static final Logger logger = LoggerFactory.getLogger(ConditionCoverageSettings.class);

    static final String CONFIG_KEY = "condition_coverage";

    /**
     * Values given on the command line. Null means "not given".
     */
    public record CliOverrides(
            Path sourceRoot,
            Path coverageReport,
            Path reportDirectory,
            Double failUnder,
            Integer parallelism) {

        public static CliOverrides none() {
            return new CliOverrides(null, null, null, null, null);
        }
    }

    private ConditionCoverageSettings() {
        /* this is only a utility class */
    }

    /**
     * Load configuration from a YAML file, applying CLI overrides where provided.
     *
     * @param configFile YAML file, or null to use defaults and CLI values only
     * @param cli        command-line values
     * @return complete configuration
     * @throws IOException if the file cannot be read or is not valid YAML
     */
    public static ConditionCoverageConfig load(Path configFile, CliOverrides cli) throws IOException {
        Map<String, Object> section = Map.of();
        if (configFile != null) {
            section = readSection(configFile);
        }
        return fromMap(section, cli);
    }

    /**
     * Build configuration from an already parsed {@code condition_coverage} section.
     */
    public static ConditionCoverageConfig fromMap(Map<String, Object> config, CliOverrides cli) {
        Path sourceRoot = cli.sourceRoot() != null ? cli.sourceRoot() : getPath(config, "source_root", Path.of("."));
        Path coverageReport = cli.coverageReport() != null
                ? cli.coverageReport()
                : getPath(config, "coverage_report", ConditionCoverageConfig.DEFAULT_COVERAGE_REPORT);
        Path reportDirectory = cli.reportDirectory() != null
                ? cli.reportDirectory()
                : getPath(config, "report_directory", ConditionCoverageConfig.DEFAULT_REPORT_DIRECTORY);
        double failUnder = cli.failUnder() != null ? cli.failUnder() : getDouble(config, "fail_under", 0.0);
        int parallelism = cli.parallelism() != null ? cli.parallelism() : getInt(config, "parallelism", 1);

        List<String> excludePatterns = getListString(config, "exclude_patterns");
        if (excludePatterns.isEmpty()) {
            excludePatterns = ConditionCoverageConfig.defaultExcludePatterns();
        }

        return new ConditionCoverageConfig(
                sourceRoot,
                coverageReport,
                reportDirectory,
                buildThresholds(config),
                excludePatterns,
                parallelism,
                failUnder);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readSection(Path configFile) throws IOException {
        Object root;
        try (InputStream in = Files.newInputStream(configFile)) {
            root = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML in " + configFile + ": " + e.getMessage(), e);
        }

        if (root instanceof Map<?, ?> rootMap) {
            Object section = rootMap.get(CONFIG_KEY);
            if (section instanceof Map) {
                return (Map<String, Object>) section;
            }
        }
        logger.warn("No '{}' section in {}, using defaults", CONFIG_KEY, configFile);
        return Map.of();
    }

    private static SeverityThresholds buildThresholds(Map<String, Object> config) {
        Object thresholdsObj = config.get("thresholds");
        if (thresholdsObj instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> thresholds = (Map<String, Object>) thresholdsObj;
            SeverityThresholds defaults = SeverityThresholds.defaults();
            return new SeverityThresholds(
                    getDouble(thresholds, "good", defaults.good()),
                    getDouble(thresholds, "warning", defaults.warning()));
        }
        return SeverityThresholds.defaults();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static Path getPath(Map<String, Object> map, String key, Path defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return Path.of(value.toString());
        }
        return defaultValue;
    }

    /**
     * YAML scalars such as numbers are taken by their string form; null entries are skipped.
     */
    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().filter(Objects::nonNull).map(String::valueOf).toList();
        }
        return List.of();
    }
}

package com.raditha.condcov.cli;

import com.raditha.condcov.analyzer.ConditionCoverageAnalyzer;
import com.raditha.condcov.analyzer.ProjectCoverageReport;
import com.raditha.condcov.config.ConditionCoverageConfig;
import com.raditha.condcov.config.ConditionCoverageSettings;
import com.raditha.condcov.coverage.data.CoverageDataLoader;
import com.raditha.condcov.coverage.data.CoverageDataSource;
import com.raditha.condcov.report.CoverageReportExporter;
import com.raditha.condcov.report.ReportFormat;
import com.raditha.condcov.report.TextReportPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the condition coverage analyzer.
 * <p>
 * Usage:
 * java -jar condcov.jar --source-root src/main/java --coverage-report target/site/jacoco/jacoco.xml
 * <p>
 * Configuration priority: CLI arguments > config file > defaults
 */
@Command(name = "condcov", mixinStandardHelpOptions = true, version = "condcov 1.0.0",
        description = "Condition coverage report from line coverage data")
@SuppressWarnings("java:S106")
public class ConditionCoverageCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(ConditionCoverageCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_INTERRUPTED = 4;
    static final int EXIT_BELOW_THRESHOLD = 5;

    @Option(names = "--config-file", description = "YAML configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--source-root", description = "Directory containing the Java sources", paramLabel = "<path>")
    private String sourceRoot;

    @Option(names = "--coverage-report", description = "JaCoCo XML report or JSON line map", paramLabel = "<path>")
    private String coverageReport;

    @Option(names = "--report-dir", description = "Directory for the generated reports", paramLabel = "<path>")
    private String reportDirectory;

    @Option(names = "--fail-under", description = "Exit with status 5 when total coverage is below this percentage",
            paramLabel = "<percent>")
    private Double failUnder;

    @Option(names = "--parallelism", description = "Number of files analyzed concurrently", paramLabel = "<n>")
    private Integer parallelism;

    @Option(names = "--format", description = "Report files to write: ${COMPLETION-CANDIDATES} (default: both)",
            paramLabel = "<format>", converter = ReportFormatConverter.class)
    private ReportFormat format = ReportFormat.BOTH;

    @Option(names = {"-q", "--quiet"}, description = "Do not print the coverage table")
    private boolean quiet = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        ConditionCoverageConfig config = ConditionCoverageSettings.load(
                configFile != null ? Path.of(configFile) : null,
                new ConditionCoverageSettings.CliOverrides(
                        sourceRoot != null ? Path.of(sourceRoot) : null,
                        coverageReport != null ? Path.of(coverageReport) : null,
                        reportDirectory != null ? Path.of(reportDirectory) : null,
                        failUnder,
                        parallelism));

        logger.info("Initializing condition coverage for source root: {}", config.sourceRoot());
        CoverageDataSource coverageData = CoverageDataLoader.load(config.coverageReport());

        ConditionCoverageAnalyzer analyzer = new ConditionCoverageAnalyzer(config, coverageData);
        ProjectCoverageReport report = analyzer.analyzeProject();

        if (!quiet) {
            new TextReportPrinter(System.out, config.thresholds()).print(report);
        }

        List<Path> written = new CoverageReportExporter(config.thresholds())
                .export(report, config.reportDirectory(), format);
        for (Path path : written) {
            System.out.println("✓ Report written to: " + path.toAbsolutePath());
        }

        if (config.isFailUnderEnabled() && !report.meetsThreshold(config.failUnder())) {
            System.err.printf("Condition coverage %.1f%% is below the required %.1f%%%n",
                    report.totalConditionCoverage(), config.failUnder());
            return EXIT_BELOW_THRESHOLD;
        }
        return EXIT_OK;
    }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Command line with the error handlers installed.
     */
    static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new ConditionCoverageCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return EXIT_INTERRUPTED;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_ERROR;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIG;
        });

        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (failUnder != null && (failUnder < 0 || failUnder > 100)) {
            throw new IllegalArgumentException("Fail-under must be between 0 and 100, got: " + failUnder);
        }

        if (parallelism != null && parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be positive, got: " + parallelism);
        }

        if (configFile != null && !new File(configFile).exists()) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (sourceRoot != null && !new File(sourceRoot).isDirectory()) {
            throw new IllegalArgumentException("Source root not found: " + sourceRoot);
        }

        if (reportDirectory != null) {
            File outputDir = new File(reportDirectory);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new IllegalArgumentException("Report path exists but is not a directory: " + reportDirectory);
            }
        }
    }

    /**
     * Custom converter for ReportFormat enum to handle CLI string values.
     */
    public static class ReportFormatConverter implements ITypeConverter<ReportFormat> {
        @Override
        public ReportFormat convert(String value) {
            return ReportFormat.fromString(value);
        }
    }
}

package com.raditha.condcov.analyzer;

import com.raditha.condcov.config.ConditionCoverageConfig;
import com.raditha.condcov.coverage.CoverageAggregator;
import com.raditha.condcov.coverage.ExecutedLines;
import com.raditha.condcov.coverage.FileCoverage;
import com.raditha.condcov.coverage.data.CoverageDataSource;
import com.raditha.condcov.extraction.ConditionExtractor;
import com.raditha.condcov.extraction.SourceParseException;
import com.raditha.condcov.model.SourceStructure;
import com.raditha.condcov.scanner.SourceScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Main orchestrator for condition coverage.
 * Looks up the executed lines of each source file, extracts its conditions,
 * aggregates coverage and collects the per-file results into one report.
 * <p>
 * A file without coverage data, or one that fails to read or parse, is logged
 * and left out; it never stops the rest of the run.
 */
public class ConditionCoverageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ConditionCoverageAnalyzer.class);

    private final ConditionCoverageConfig config;
    private final CoverageDataSource coverageData;
    private final SourceScanner scanner;
    private final ConditionExtractor extractor;
    private final CoverageAggregator aggregator;

    public ConditionCoverageAnalyzer(ConditionCoverageConfig config, CoverageDataSource coverageData) {
        this.config = config;
        this.coverageData = coverageData;
        this.scanner = new SourceScanner(config);
        this.extractor = new ConditionExtractor();
        this.aggregator = new CoverageAggregator();
    }

    /**
     * Scan the source root and analyze everything found.
     */
    public ProjectCoverageReport analyzeProject() throws IOException, InterruptedException {
        return analyzeProject(scanner.scan());
    }

    /**
     * Analyze the given source files.
     *
     * @param sourceFiles absolute paths under the source root
     * @return report with one entry per analyzed file
     * @throws InterruptedException if interrupted while waiting for worker threads
     */
    public ProjectCoverageReport analyzeProject(List<Path> sourceFiles) throws InterruptedException {
        logger.info("Found {} files with coverage data", coverageData.measuredFiles().size());

        List<FileOutcome> outcomes = config.parallelism() > 1 && sourceFiles.size() > 1
                ? analyzeInParallel(sourceFiles)
                : sourceFiles.stream().map(this::analyzeFile).toList();

        Map<String, FileCoverage> files = new HashMap<>();
        List<SkippedFile> skipped = new ArrayList<>();
        for (FileOutcome outcome : outcomes) {
            if (outcome.coverage() != null) {
                files.put(outcome.path(), outcome.coverage());
            } else {
                skipped.add(outcome.skipped());
            }
        }

        ProjectCoverageReport report = new ProjectCoverageReport(files, skipped);
        logger.info(report.getSummary());
        return report;
    }

    /**
     * Extract and aggregate one source unit. This is the engine without any I/O.
     *
     * @throws SourceParseException if the source is not valid Java
     */
    public FileCoverage analyzeSource(String source, ExecutedLines executed) throws SourceParseException {
        SourceStructure structure = extractor.extract(source);
        return aggregator.aggregate(structure, executed);
    }

    FileOutcome analyzeFile(Path sourceFile) {
        String relativePath = scanner.relativize(sourceFile);

        Optional<ExecutedLines> executed = coverageData.executedLines(relativePath);
        if (executed.isEmpty()) {
            logger.warn("No coverage data for: {}", relativePath);
            return FileOutcome.skipped(relativePath, SkippedFile.Reason.NO_COVERAGE_DATA, "no coverage data");
        }

        try {
            String source = Files.readString(sourceFile);
            FileCoverage coverage = analyzeSource(source, executed.get());
            logger.debug("{}: {}/{} conditions covered ({}%)", relativePath,
                    coverage.counts().covered(), coverage.counts().total(),
                    String.format("%.1f", coverage.coveragePercentage()));
            return FileOutcome.analyzed(relativePath, coverage);
        } catch (SourceParseException e) {
            logger.error("Error parsing {}: {}", relativePath, e.getMessage());
            return FileOutcome.skipped(relativePath, SkippedFile.Reason.PARSE_ERROR, e.getMessage());
        } catch (IOException e) {
            logger.error("Error reading {}: {}", relativePath, e.getMessage());
            return FileOutcome.skipped(relativePath, SkippedFile.Reason.READ_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Error processing {}", relativePath, e);
            return FileOutcome.skipped(relativePath, SkippedFile.Reason.ANALYSIS_ERROR, String.valueOf(e.getMessage()));
        }
    }

    private List<FileOutcome> analyzeInParallel(List<Path> sourceFiles) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(config.parallelism());
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>();
            for (Path sourceFile : sourceFiles) {
                futures.add(executor.submit(() -> analyzeFile(sourceFile)));
            }

            List<FileOutcome> outcomes = new ArrayList<>();
            for (Future<FileOutcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (ExecutionException e) {
            // analyzeFile handles its own failures, so only errors reach here
            throw new IllegalStateException("Worker failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Result of one file: either its coverage or the reason it was skipped.
     */
    record FileOutcome(String path, FileCoverage coverage, SkippedFile skipped) {

        static FileOutcome analyzed(String path, FileCoverage coverage) {
            return new FileOutcome(path, coverage, null);
        }

        static FileOutcome skipped(String path, SkippedFile.Reason reason, String detail) {
            return new FileOutcome(path, null, new SkippedFile(path, reason, detail));
        }
    }
}

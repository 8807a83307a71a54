package com.raditha.condcov.analyzer;

import com.raditha.condcov.coverage.CoverageCounts;
import com.raditha.condcov.coverage.FileCoverage;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Condition coverage for every analyzed file of a project.
 *
 * @param files   coverage per file, keyed and sorted by path relative to the source root
 * @param skipped files that were discovered but not analyzed
 */
public record ProjectCoverageReport(Map<String, FileCoverage> files, List<SkippedFile> skipped) {

    public ProjectCoverageReport {
        files = Collections.unmodifiableMap(new TreeMap<>(files));
        skipped = List.copyOf(skipped);
    }

    /**
     * Conditions summed over all files.
     */
    public CoverageCounts totalCounts() {
        return files.values().stream()
                .map(FileCoverage::counts)
                .reduce(CoverageCounts.EMPTY, CoverageCounts::plus);
    }

    /**
     * Sum of covered over sum of total across files, not an average of the file
     * percentages. 100.0 when no file has a condition.
     */
    public double totalConditionCoverage() {
        return totalCounts().percentage();
    }

    public boolean meetsThreshold(double minimumPercentage) {
        return totalConditionCoverage() >= minimumPercentage;
    }

    public int getFileCount() {
        return files.size();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        CoverageCounts totals = totalCounts();
        return String.format(
                "Condition coverage %.1f%% (%d/%d conditions) in %d files, %d skipped",
                totals.percentage(),
                totals.covered(),
                totals.total(),
                files.size(),
                skipped.size());
    }
}

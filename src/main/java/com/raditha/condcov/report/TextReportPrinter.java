package com.raditha.condcov.report;

import com.raditha.condcov.analyzer.ProjectCoverageReport;
import com.raditha.condcov.analyzer.SkippedFile;
import com.raditha.condcov.coverage.ClassCoverage;
import com.raditha.condcov.coverage.CoverageCounts;
import com.raditha.condcov.coverage.FileCoverage;
import com.raditha.condcov.coverage.MethodCoverage;

import java.io.PrintStream;
import java.util.Map;

/**
 * Prints the coverage table to a console stream: one row per file, indented
 * rows per class and double-indented rows per method.
 */
public class TextReportPrinter {

    private static final int NAME_WIDTH = 60;

    private final PrintStream out;
    private final SeverityThresholds thresholds;

    public TextReportPrinter(PrintStream out, SeverityThresholds thresholds) {
        this.out = out;
        this.thresholds = thresholds;
    }

    public void print(ProjectCoverageReport report) {
        out.println("=".repeat(80));
        out.println("CONDITION COVERAGE REPORT");
        out.println("=".repeat(80));
        out.println();

        if (report.files().isEmpty()) {
            out.println("No files analyzed.");
        }

        for (Map.Entry<String, FileCoverage> entry : report.files().entrySet()) {
            FileCoverage file = entry.getValue();
            printRow(0, entry.getKey(), file.counts());
            for (ClassCoverage clazz : file.classes().values()) {
                printRow(1, "Class: " + clazz.name(), clazz.counts());
                for (MethodCoverage method : clazz.methods().values()) {
                    printRow(2, "Method: " + method.name(), method.counts());
                }
            }
        }

        if (!report.skipped().isEmpty()) {
            out.println();
            out.printf("Skipped %d files:%n", report.skipped().size());
            for (SkippedFile skipped : report.skipped()) {
                out.printf("  %s (%s: %s)%n", skipped.path(), skipped.reason(), skipped.detail());
            }
        }

        CoverageCounts totals = report.totalCounts();
        out.println();
        out.println("=".repeat(80));
        out.printf("TOTAL CONDITION COVERAGE: %.1f%% (%d/%d)%n",
                totals.percentage(), totals.covered(), totals.total());
        out.println("=".repeat(80));
    }

    private void printRow(int depth, String name, CoverageCounts counts) {
        String indented = "  ".repeat(depth) + name;
        if (indented.length() > NAME_WIDTH) {
            indented = indented.substring(0, NAME_WIDTH - 3) + "...";
        }
        Severity severity = thresholds.classify(counts.percentage());
        out.printf("%s %-" + NAME_WIDTH + "s %6.1f%% %9s%n",
                severity.marker(), indented, counts.percentage(), counts.covered() + "/" + counts.total());
    }
}

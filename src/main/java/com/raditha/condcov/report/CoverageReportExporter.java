package com.raditha.condcov.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.condcov.analyzer.ProjectCoverageReport;
import com.raditha.condcov.coverage.ClassCoverage;
import com.raditha.condcov.coverage.FileCoverage;
import com.raditha.condcov.coverage.MethodCoverage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports condition coverage to JSON and HTML files.
 * Percentages are written unrounded to JSON and with one decimal to HTML.
 */
public class CoverageReportExporter {

    private static final Logger logger = LoggerFactory.getLogger(CoverageReportExporter.class);

    public static final String JSON_FILE_NAME = "condition_coverage.json";
    public static final String HTML_FILE_NAME = "condition_coverage.html";

    private static final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final SeverityThresholds thresholds;

    public CoverageReportExporter(SeverityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * JSON document root.
     */
    @JsonPropertyOrder({"files", "total_condition_coverage"})
    public record ReportDTO(Map<String, FileDTO> files, double totalConditionCoverage) {
    }

    @JsonPropertyOrder({"condition_coverage", "total_conditions", "covered_conditions", "classes"})
    public record FileDTO(double conditionCoverage, int totalConditions, int coveredConditions,
                          Map<String, ClassDTO> classes) {
    }

    @JsonPropertyOrder({"total_conditions", "covered_conditions", "coverage_percentage", "methods"})
    public record ClassDTO(int totalConditions, int coveredConditions, double coveragePercentage,
                           Map<String, MethodDTO> methods) {
    }

    @JsonPropertyOrder({"total_conditions", "covered_conditions", "coverage_percentage"})
    public record MethodDTO(int totalConditions, int coveredConditions, double coveragePercentage) {
    }

    /**
     * Write the requested report files into a directory, creating it if needed.
     *
     * @return the files written
     */
    public List<Path> export(ProjectCoverageReport report, Path reportDirectory, ReportFormat format)
            throws IOException {
        Files.createDirectories(reportDirectory);
        List<Path> written = new ArrayList<>();

        if (format.includesJson()) {
            Path jsonPath = reportDirectory.resolve(JSON_FILE_NAME);
            exportToJson(report, jsonPath);
            written.add(jsonPath);
        }
        if (format.includesHtml()) {
            Path htmlPath = reportDirectory.resolve(HTML_FILE_NAME);
            exportToHtml(report, htmlPath);
            written.add(htmlPath);
        }

        logger.info("Reports generated in {}", reportDirectory.toAbsolutePath());
        return written;
    }

    /**
     * Build the serializable form of a report.
     */
    public ReportDTO toDTO(ProjectCoverageReport report) {
        Map<String, FileDTO> files = new LinkedHashMap<>();
        report.files().forEach((path, file) -> files.put(path, toFileDTO(file)));
        return new ReportDTO(files, report.totalConditionCoverage());
    }

    /**
     * Export coverage to JSON format.
     */
    public void exportToJson(ProjectCoverageReport report, Path outputPath) throws IOException {
        mapper.writeValue(outputPath.toFile(), toDTO(report));
    }

    public String toJson(ProjectCoverageReport report) throws IOException {
        return mapper.writeValueAsString(toDTO(report));
    }

    /**
     * Export coverage to an HTML page.
     */
    public void exportToHtml(ProjectCoverageReport report, Path outputPath) throws IOException {
        Files.writeString(outputPath, toHtml(report));
    }

    public String toHtml(ProjectCoverageReport report) {
        StringBuilder html = new StringBuilder();
        html.append("""
                <!DOCTYPE html>
                <html>
                <head>
                    <meta charset="UTF-8">
                    <title>Condition Coverage Report</title>
                    <style>
                        body { font-family: Arial, sans-serif; margin: 20px; }
                        table { border-collapse: collapse; width: 100%; margin-bottom: 20px; }
                        th, td { border: 1px solid #ddd; padding: 8px; text-align: left; }
                        th { background-color: #f2f2f2; }
                        .coverage-good { background-color: #dff0d8; }
                        .coverage-warning { background-color: #fcf8e3; }
                        .coverage-bad { background-color: #f2dede; }
                        .indent { padding-left: 40px; }
                        .double-indent { padding-left: 80px; }
                        .file-row { font-weight: bold; }
                    </style>
                </head>
                <body>
                    <h1>Condition Coverage Report</h1>
                """);
        html.append(String.format("    <h2>Total Condition Coverage: %.1f%%</h2>%n", report.totalConditionCoverage()));
        html.append("""
                    <h3>Coverage Details</h3>
                    <table>
                        <tr>
                            <th>Name</th>
                            <th>Coverage</th>
                            <th>Covered/Total</th>
                        </tr>
                """);

        for (Map.Entry<String, FileCoverage> entry : report.files().entrySet()) {
            FileCoverage file = entry.getValue();
            appendRow(html, thresholds.classify(file.coveragePercentage()).cssClass() + " file-row", "",
                    entry.getKey(), file.coveragePercentage(), file.counts().covered(), file.counts().total());

            for (ClassCoverage clazz : file.classes().values()) {
                appendRow(html, thresholds.classify(clazz.coveragePercentage()).cssClass(), "indent",
                        "Class: " + clazz.name(), clazz.coveragePercentage(),
                        clazz.counts().covered(), clazz.counts().total());

                for (MethodCoverage method : clazz.methods().values()) {
                    appendRow(html, thresholds.classify(method.coveragePercentage()).cssClass(), "double-indent",
                            "Method: " + method.name(), method.coveragePercentage(),
                            method.counts().covered(), method.counts().total());
                }
            }
        }

        html.append("""
                    </table>
                </body>
                </html>
                """);
        return html.toString();
    }

    private static void appendRow(StringBuilder html, String rowClass, String nameClass, String name,
                                  double percentage, int covered, int total) {
        html.append(String.format("        <tr class=\"%s\">%n", rowClass));
        if (nameClass.isEmpty()) {
            html.append(String.format("            <td>%s</td>%n", escapeHtml(name)));
        } else {
            html.append(String.format("            <td class=\"%s\">%s</td>%n", nameClass, escapeHtml(name)));
        }
        html.append(String.format("            <td>%.1f%%</td>%n", percentage));
        html.append(String.format("            <td>%d/%d</td>%n", covered, total));
        html.append("        </tr>\n");
    }

    static String escapeHtml(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '&' -> escaped.append("&amp;");
                case '"' -> escaped.append("&quot;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static FileDTO toFileDTO(FileCoverage file) {
        Map<String, ClassDTO> classes = new LinkedHashMap<>();
        for (ClassCoverage clazz : file.classes().values()) {
            Map<String, MethodDTO> methods = new LinkedHashMap<>();
            for (MethodCoverage method : clazz.methods().values()) {
                methods.put(method.name(), new MethodDTO(
                        method.counts().total(),
                        method.counts().covered(),
                        method.coveragePercentage()));
            }
            classes.put(clazz.name(), new ClassDTO(
                    clazz.counts().total(),
                    clazz.counts().covered(),
                    clazz.coveragePercentage(),
                    methods));
        }
        return new FileDTO(
                file.coveragePercentage(),
                file.counts().total(),
                file.counts().covered(),
                classes);
    }
}

package com.raditha.condcov.scanner;

import com.raditha.condcov.config.ConditionCoverageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Discovers the Java source files under the configured source root.
 */
public class SourceScanner {

    private static final Logger logger = LoggerFactory.getLogger(SourceScanner.class);

    private static final String JAVA_EXTENSION = ".java";

    private final ConditionCoverageConfig config;

    public SourceScanner(ConditionCoverageConfig config) {
        this.config = config;
    }

    /**
     * Scan and return all Java source files, absolute and sorted, minus the excluded ones.
     *
     * @throws IOException if the source root cannot be walked
     */
    public List<Path> scan() throws IOException {
        Path root = config.sourceRoot().toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IOException("Source root is not a directory: " + root);
        }

        List<Path> sourceFiles;
        try (Stream<Path> paths = Files.walk(root)) {
            sourceFiles = paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(JAVA_EXTENSION))
                    .filter(p -> !config.shouldExclude(relativize(p)))
                    .map(Path::toAbsolutePath)
                    .sorted()
                    .toList();
        }

        logger.info("Found {} Java files under {}", sourceFiles.size(), root);
        return sourceFiles;
    }

    /**
     * Path of a source file relative to the source root, with forward slashes.
     * This is the key used to look up coverage data and to name files in reports.
     */
    public String relativize(Path sourceFile) {
        Path root = config.sourceRoot().toAbsolutePath().normalize();
        return root.relativize(sourceFile.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }
}

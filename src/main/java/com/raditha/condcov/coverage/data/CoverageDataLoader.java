package com.raditha.condcov.coverage.data;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Chooses a reader for a coverage file by its extension.
 */
public class CoverageDataLoader {

    private CoverageDataLoader() {
        /* this is only a utility class */
    }

    /**
     * Load line coverage from a JaCoCo XML report or a JSON line map.
     *
     * @throws IllegalArgumentException if the extension is not {@code .xml} or {@code .json}
     * @throws IOException              if the file is missing or cannot be parsed
     */
    public static CoverageDataSource load(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (!name.endsWith(".xml") && !name.endsWith(".json")) {
            throw new IllegalArgumentException("Unsupported coverage format (expected .xml or .json): " + file);
        }
        if (!Files.isRegularFile(file)) {
            throw new IOException("Coverage report not found: " + file);
        }
        return name.endsWith(".xml") ? JacocoXmlCoverageData.read(file) : JsonLineCoverageData.read(file);
    }
}

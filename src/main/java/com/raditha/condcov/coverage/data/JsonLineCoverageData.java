package com.raditha.condcov.coverage.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.condcov.coverage.ExecutedLines;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads executed lines from a JSON line map:
 * <pre>
 * { "files": { "com/example/Foo.java": [3, 4, 9] } }
 * </pre>
 */
public class JsonLineCoverageData {

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * DTO matching the document layout.
     */
    public record LineMapDTO(Map<String, List<Integer>> files) {
    }

    private JsonLineCoverageData() {
        /* this is only a utility class */
    }

    public static CoverageDataSource read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public static CoverageDataSource read(InputStream in) throws IOException {
        LineMapDTO dto;
        try {
            dto = mapper.readValue(in, LineMapDTO.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed line coverage JSON: " + e.getOriginalMessage(), e);
        }

        Map<String, ExecutedLines> executed = new HashMap<>();
        if (dto.files() != null) {
            dto.files().forEach((path, lines) -> {
                List<Integer> present = lines != null ? lines : List.of();
                executed.put(normalize(path), ExecutedLines.of(present));
            });
        }
        return new InMemoryCoverageData(executed);
    }

    private static String normalize(String path) {
        return path.replace('\\', '/');
    }
}

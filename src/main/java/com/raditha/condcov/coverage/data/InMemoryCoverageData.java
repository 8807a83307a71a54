package com.raditha.condcov.coverage.data;

import com.raditha.condcov.coverage.ExecutedLines;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Coverage data already loaded into memory. The file readers produce this.
 */
public class InMemoryCoverageData implements CoverageDataSource {

    private final Map<String, ExecutedLines> linesByPath;

    public InMemoryCoverageData(Map<String, ExecutedLines> linesByPath) {
        this.linesByPath = Collections.unmodifiableMap(new TreeMap<>(linesByPath));
    }

    @Override
    public Optional<ExecutedLines> executedLines(String relativePath) {
        return Optional.ofNullable(linesByPath.get(relativePath));
    }

    @Override
    public Set<String> measuredFiles() {
        return linesByPath.keySet();
    }
}

package com.raditha.condcov.coverage.data;

import com.raditha.condcov.coverage.ExecutedLines;

import java.util.Optional;
import java.util.Set;

/**
 * Line coverage measured during a test run, keyed by source path relative to
 * the source root with forward slashes ({@code com/example/Foo.java}).
 */
public interface CoverageDataSource {

    /**
     * Executed lines of a file, or empty when the run has no data for it.
     */
    Optional<ExecutedLines> executedLines(String relativePath);

    /**
     * Every relative path the run has data for.
     */
    Set<String> measuredFiles();
}

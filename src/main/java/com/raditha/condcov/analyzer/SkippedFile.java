package com.raditha.condcov.analyzer;

/**
 * A source file left out of the report, and why.
 *
 * @param path   path relative to the source root
 * @param reason category of the failure
 * @param detail message for the log and the console summary
 */
public record SkippedFile(String path, Reason reason, String detail) {

    public enum Reason {
        /**
         * The coverage run has no entry for the file.
         */
        NO_COVERAGE_DATA,
        /**
         * The file is not valid Java.
         */
        PARSE_ERROR,
        /**
         * The file could not be read.
         */
        READ_ERROR,
        /**
         * Anything else that went wrong while analyzing the file.
         */
        ANALYSIS_ERROR
    }
}

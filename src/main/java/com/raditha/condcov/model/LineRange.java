package com.raditha.condcov.model;

/**
 * An inclusive range of source lines.
 *
 * @param startLine Starting line number (1-indexed)
 * @param endLine   Ending line number (1-indexed, inclusive)
 */
public record LineRange(int startLine, int endLine) {

    /**
     * Create from a JavaParser Range, dropping the column information.
     */
    public static LineRange from(com.github.javaparser.Range jpRange) {
        return new LineRange(jpRange.begin.line, jpRange.end.line);
    }

    public boolean contains(int line) {
        return startLine <= line && line <= endLine;
    }
}

package com.raditha.condcov.report;

/**
 * Visual severity of a coverage percentage.
 */
public enum Severity {
    GOOD("coverage-good", "+"),
    WARNING("coverage-warning", "~"),
    BAD("coverage-bad", "!");

    private final String cssClass;
    private final String marker;

    Severity(String cssClass, String marker) {
        this.cssClass = cssClass;
        this.marker = marker;
    }

    public String cssClass() {
        return cssClass;
    }

    /**
     * Single character shown in the console table.
     */
    public String marker() {
        return marker;
    }
}

package com.raditha.condcov.report;

import java.util.Locale;

/**
 * Which report files to write.
 */
public enum ReportFormat {
    HTML,
    JSON,
    BOTH;

    public boolean includesHtml() {
        return this == HTML || this == BOTH;
    }

    public boolean includesJson() {
        return this == JSON || this == BOTH;
    }

    /**
     * Parse a CLI value (case-insensitive).
     *
     * @throws IllegalArgumentException for anything but html, json or both
     */
    public static ReportFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Report format cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "html" -> HTML;
            case "json" -> JSON;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException(
                    "Report format must be 'html', 'json', or 'both', got: " + value);
        };
    }

    public String toCliString() {
        return name().toLowerCase(Locale.ROOT);
    }
}

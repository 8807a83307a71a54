package com.raditha.condcov.report;

/**
 * Percentage limits for the three severity tiers. The same limits apply to
 * files, classes and methods.
 *
 * @param good    lowest percentage shown as {@link Severity#GOOD}
 * @param warning lowest percentage shown as {@link Severity#WARNING}
 */
public record SeverityThresholds(double good, double warning) {

    public SeverityThresholds {
        if (warning < 0.0 || good > 100.0) {
            throw new IllegalArgumentException("Thresholds must be between 0 and 100");
        }
        if (warning > good) {
            throw new IllegalArgumentException(
                    "Warning threshold (" + warning + ") must not exceed good threshold (" + good + ")");
        }
    }

    public static SeverityThresholds defaults() {
        return new SeverityThresholds(80.0, 60.0);
    }

    public Severity classify(double percentage) {
        if (percentage >= good) {
            return Severity.GOOD;
        }
        if (percentage >= warning) {
            return Severity.WARNING;
        }
        return Severity.BAD;
    }
}

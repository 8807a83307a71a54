package com.raditha.condcov.coverage;

import com.raditha.condcov.model.ConditionNode;

import java.util.Collection;

/**
 * Condition totals for one scope.
 *
 * @param total   conditions whose line falls in the scope
 * @param covered those of them whose line executed
 */
public record CoverageCounts(int total, int covered) {

    public static final CoverageCounts EMPTY = new CoverageCounts(0, 0);

    public CoverageCounts {
        if (total < 0 || covered < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        if (covered > total) {
            throw new IllegalArgumentException("Covered (" + covered + ") exceeds total (" + total + ")");
        }
    }

    /**
     * Count the given conditions against the executed lines.
     */
    public static CoverageCounts of(Collection<ConditionNode> conditions, ExecutedLines executed) {
        int covered = (int) conditions.stream()
                .filter(c -> executed.contains(c.line()))
                .count();
        return new CoverageCounts(conditions.size(), covered);
    }

    /**
     * Percentage of covered conditions, unrounded. A scope without conditions is fully covered.
     */
    public double percentage() {
        return percentage(covered, total);
    }

    public static double percentage(long covered, long total) {
        if (total == 0) {
            return 100.0;
        }
        return (double) covered / total * 100;
    }

    public CoverageCounts plus(CoverageCounts other) {
        return new CoverageCounts(total + other.total, covered + other.covered);
    }
}

package com.raditha.condcov.coverage;

import com.raditha.condcov.model.LineRange;

/**
 * Coverage of one method or constructor.
 */
public record MethodCoverage(String name, LineRange range, CoverageCounts counts) {

    public double coveragePercentage() {
        return counts.percentage();
    }
}

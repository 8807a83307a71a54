package com.raditha.condcov.coverage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Condition coverage of a single source unit.
 */
public record FileCoverage(CoverageCounts counts, Map<String, ClassCoverage> classes) {

    public FileCoverage {
        classes = Collections.unmodifiableMap(new LinkedHashMap<>(classes));
    }

    public double coveragePercentage() {
        return counts.percentage();
    }
}

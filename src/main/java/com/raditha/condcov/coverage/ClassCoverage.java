package com.raditha.condcov.coverage;

import com.raditha.condcov.model.LineRange;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Coverage of one type declaration and of the methods declared in it.
 * The class counts are taken over its whole range, so conditions in field
 * initializers or initializer blocks count here but in no method.
 */
public record ClassCoverage(String name, LineRange range, CoverageCounts counts, Map<String, MethodCoverage> methods) {

    public ClassCoverage {
        methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    public double coveragePercentage() {
        return counts.percentage();
    }
}

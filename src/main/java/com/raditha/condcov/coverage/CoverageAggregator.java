package com.raditha.condcov.coverage;

import com.raditha.condcov.model.ClassInfo;
import com.raditha.condcov.model.ConditionNode;
import com.raditha.condcov.model.LineRange;
import com.raditha.condcov.model.SourceStructure;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the executed lines of a test run into condition coverage for a file,
 * its classes and their methods.
 * <p>
 * Every scope is computed by filtering the complete condition list by the
 * scope's line range. Classes are never summed from their methods and the
 * conditions are never partitioned between classes, so a condition that lies
 * inside two overlapping ranges (a nested type and its outer type) is counted
 * by both.
 */
public class CoverageAggregator {

    /**
     * Compute coverage for one source unit.
     *
     * @param structure output of the condition extractor
     * @param executed  lines that ran
     * @return coverage at file, class and method level
     */
    public FileCoverage aggregate(SourceStructure structure, ExecutedLines executed) {
        List<ConditionNode> conditions = structure.conditions();

        Map<String, ClassCoverage> classes = new LinkedHashMap<>();
        for (ClassInfo classInfo : structure.classTable().all()) {
            classes.put(classInfo.name(), aggregateClass(classInfo, structure, executed));
        }

        return new FileCoverage(CoverageCounts.of(conditions, executed), classes);
    }

    private ClassCoverage aggregateClass(ClassInfo classInfo, SourceStructure structure, ExecutedLines executed) {
        CoverageCounts classCounts = CoverageCounts.of(structure.conditionsIn(classInfo.range()), executed);

        Map<String, MethodCoverage> methods = new LinkedHashMap<>();
        for (Map.Entry<String, LineRange> method : classInfo.methods().entrySet()) {
            LineRange range = method.getValue();
            CoverageCounts counts = CoverageCounts.of(structure.conditionsIn(range), executed);
            methods.put(method.getKey(), new MethodCoverage(method.getKey(), range, counts));
        }

        return new ClassCoverage(classInfo.name(), classInfo.range(), classCounts, methods);
    }
}

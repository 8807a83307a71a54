package com.raditha.condcov.extraction;

import com.raditha.condcov.model.ClassInfo;
import com.raditha.condcov.model.ClassTable;
import com.raditha.condcov.model.ConditionNode;
import com.raditha.condcov.model.LineRange;
import com.raditha.condcov.model.SourceStructure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects what a single traversal discovers. One sink per extraction, never shared.
 * <p>
 * Conditions are kept as a list with one entry per visited syntax node. A left
 * operand such as the {@code a && b} in {@code a && b || c} starts at the same
 * token as its parent, so start positions do not identify a condition.
 */
class ExtractionSink {

    private final List<ConditionNode> conditions = new ArrayList<>();
    private final Map<String, LineRange> classRanges = new LinkedHashMap<>();
    private final Map<String, Map<String, LineRange>> methodRanges = new LinkedHashMap<>();

    void addCondition(ConditionNode condition) {
        conditions.add(condition);
    }

    /**
     * Register a type declaration and return the key it was stored under.
     * A second local type with the same dotted name gets a numeric suffix.
     */
    String addClass(String name, LineRange range) {
        String key = name;
        int occurrence = 1;
        while (classRanges.containsKey(key)) {
            occurrence++;
            key = name + "#" + occurrence;
        }
        classRanges.put(key, range);
        methodRanges.put(key, new LinkedHashMap<>());
        return key;
    }

    void addMethod(String className, String signature, LineRange range) {
        methodRanges.computeIfAbsent(className, k -> new LinkedHashMap<>()).putIfAbsent(signature, range);
    }

    SourceStructure toStructure() {
        Map<String, ClassInfo> classes = new LinkedHashMap<>();
        classRanges.forEach((name, range) ->
                classes.put(name, new ClassInfo(name, range, methodRanges.getOrDefault(name, Map.of()))));
        return new SourceStructure(conditions, new ClassTable(classes));
    }
}

package com.raditha.condcov.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Structural model of one source unit: its conditions and its class table.
 *
 * @param conditions every condition in traversal order, one per condition syntax node
 * @param classTable type declarations with their method tables
 */
public record SourceStructure(List<ConditionNode> conditions, ClassTable classTable) {

    public SourceStructure {
        conditions = List.copyOf(conditions);
    }

    public int conditionCount() {
        return conditions.size();
    }

    /**
     * Condition kinds grouped by the line they appear on.
     */
    public Map<Integer, Set<ConditionKind>> kindsByLine() {
        Map<Integer, Set<ConditionKind>> byLine = new TreeMap<>();
        for (ConditionNode condition : conditions) {
            byLine.computeIfAbsent(condition.line(), k -> EnumSet.noneOf(ConditionKind.class))
                    .add(condition.kind());
        }
        return byLine;
    }

    /**
     * Conditions whose line lies inside the given range.
     */
    public List<ConditionNode> conditionsIn(LineRange range) {
        return conditions.stream()
                .filter(c -> range.contains(c.line()))
                .toList();
    }
}

package com.raditha.condcov.model;

/**
 * The kinds of boolean decision points the extractor recognizes.
 */
public enum ConditionKind {
    /**
     * Relational or equality comparison ({@code ==}, {@code !=}, {@code <}, {@code >}, {@code <=}, {@code >=}).
     */
    COMPARISON,

    /**
     * A chain of {@code &&} or {@code ||} operands joined by the same operator.
     */
    BOOLEAN_COMBINATION,

    /**
     * Logical complement ({@code !x}). Bitwise and arithmetic negation are not conditions.
     */
    LOGICAL_NEGATION
}

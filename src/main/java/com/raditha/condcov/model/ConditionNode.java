package com.raditha.condcov.model;

/**
 * One decision point discovered in the source.
 * Only {@code line} matters for aggregation; the column keeps two conditions
 * of the same kind on one line apart.
 *
 * @param line   1-based line of the condition's first token
 * @param column 1-based column of the condition's first token
 * @param kind   classification of the expression
 * @param scope  innermost scope open when the condition was discovered
 */
public record ConditionNode(int line, int column, ConditionKind kind, Scope scope) {
}

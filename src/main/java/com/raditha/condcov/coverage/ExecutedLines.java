package com.raditha.condcov.coverage;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable set of 1-based line numbers that ran during a monitored test run.
 */
public final class ExecutedLines {

    private static final ExecutedLines NONE = new ExecutedLines(Set.of());

    private final Set<Integer> lines;

    private ExecutedLines(Set<Integer> lines) {
        this.lines = lines;
    }

    public static ExecutedLines none() {
        return NONE;
    }

    public static ExecutedLines of(int... lines) {
        Set<Integer> set = new TreeSet<>();
        for (int line : lines) {
            set.add(line);
        }
        return new ExecutedLines(Collections.unmodifiableSet(set));
    }

    public static ExecutedLines of(Collection<Integer> lines) {
        return new ExecutedLines(Collections.unmodifiableSet(new TreeSet<>(lines)));
    }

    public boolean contains(int line) {
        return lines.contains(line);
    }

    /**
     * A copy of this set with one more line.
     */
    public ExecutedLines plus(int line) {
        Set<Integer> copy = new TreeSet<>(lines);
        copy.add(line);
        return new ExecutedLines(Collections.unmodifiableSet(copy));
    }

    public Set<Integer> asSet() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExecutedLines other && lines.equals(other.lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        return "ExecutedLines" + lines;
    }
}

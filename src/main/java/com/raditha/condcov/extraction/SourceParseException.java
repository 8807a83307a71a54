package com.raditha.condcov.extraction;

import com.github.javaparser.Problem;

import java.util.List;

/**
 * Thrown when source text is not valid Java.
 */
public class SourceParseException extends Exception {

    private final transient List<Problem> problems;

    public SourceParseException(List<Problem> problems) {
        super(describe(problems));
        this.problems = List.copyOf(problems);
    }

    public List<Problem> getProblems() {
        return problems;
    }

    private static String describe(List<Problem> problems) {
        if (problems.isEmpty()) {
            return "Source could not be parsed";
        }
        Problem first = problems.get(0);
        String location = first.getLocation()
                .flatMap(l -> l.getBegin().getRange())
                .map(r -> " at line " + r.begin.line)
                .orElse("");
        String more = problems.size() > 1 ? " (+" + (problems.size() - 1) + " more)" : "";
        return first.getMessage() + location + more;
    }
}

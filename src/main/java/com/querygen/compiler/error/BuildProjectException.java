package com.querygen.compiler.error;

import java.util.List;

/**
 * Base type for terminal single-stage failures of a project build.
 *
 * Holds every problem message the stage wants to surface.
 */
public abstract class BuildProjectException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> problems;

    protected BuildProjectException(List<String> problems) {
        super(String.join(System.lineSeparator(), problems));
        this.problems = List.copyOf(problems);
    }

    protected BuildProjectException(String problem, Throwable cause) {
        super(problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> getProblems() {
        return problems;
    }
}

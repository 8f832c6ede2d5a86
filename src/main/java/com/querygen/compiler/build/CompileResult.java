package com.querygen.compiler.build;

import java.util.List;

import com.querygen.compiler.error.ResolvedError;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of a whole compilation: document syntax errors, or one outcome per built project.
 */
@Value
@Builder
public class CompileResult {
    /** Syntax errors found while parsing documents; when present no project was built. */
    @Singular
    List<ResolvedError> parseErrors;
    @Singular
    List<BuildOutcome> outcomes;

    public boolean isSuccess() {
        return parseErrors.isEmpty() && outcomes.stream().allMatch(BuildOutcome::isSuccess);
    }

    public long failedCount() {
        return outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
    }
}

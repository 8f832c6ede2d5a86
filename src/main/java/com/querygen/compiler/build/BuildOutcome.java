package com.querygen.compiler.build;

import java.util.ArrayList;
import java.util.List;

import com.querygen.compiler.error.ResolvedError;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Result of one project build: a summary on success, or the failing stage and its errors.
 *
 * Validation-category failures (IR and validation stages) carry {@link ResolvedError}s with source
 * context; other stages carry plain problem messages.
 */
@Value
@Builder
public class BuildOutcome {
    @NonNull
    String projectName;
    boolean success;
    BuildStage failedStage;
    @Singular
    List<ResolvedError> errors;
    @Singular
    List<String> problems;
    ProjectSummary summary;

    public static BuildOutcome success(ProjectSummary summary) {
        return BuildOutcome.builder()
                .projectName(summary.getProjectName())
                .success(true)
                .summary(summary)
                .build();
    }

    public static BuildOutcome failure(String projectName, BuildStage stage, List<ResolvedError> errors,
                                       List<String> problems) {
        return BuildOutcome.builder()
                .projectName(projectName)
                .success(false)
                .failedStage(stage)
                .errors(errors)
                .problems(problems)
                .build();
    }

    /**
     * Every error and problem rendered for humans.
     */
    public List<String> describeFailures() {
        List<String> lines = new ArrayList<>();
        errors.forEach(error -> lines.add(error.format()));
        lines.addAll(problems);
        return lines;
    }
}

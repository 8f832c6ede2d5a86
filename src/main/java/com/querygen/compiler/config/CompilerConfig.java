package com.querygen.compiler.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Global compiler configuration shared read-only by all project builds.
 */
@Value
@Builder(toBuilder = true)
public class CompilerConfig {

    public static final int DEFAULT_MAX_SELECTION_DEPTH = 16;

    @NonNull
    Path root;

    /** Verify that artifacts on disk are current instead of writing them. */
    boolean validate;

    @Builder.Default
    int maxSelectionDepth = DEFAULT_MAX_SELECTION_DEPTH;

    /** Projects by name, in declaration order. */
    @NonNull
    @Singular
    Map<String, ProjectConfig> projects;

    public Optional<ProjectConfig> getProject(String name) {
        return Optional.ofNullable(projects.get(name));
    }
}

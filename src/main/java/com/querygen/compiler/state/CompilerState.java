package com.querygen.compiler.state;

import java.util.Map;
import java.util.Optional;

import com.querygen.compiler.source.Sources;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Snapshot of everything read from disk for one compilation: all source texts and which of them
 * belong to which project. Immutable; shared read-only by concurrent project builds.
 */
@Value
@Builder
public class CompilerState {

    @NonNull
    Sources sources;

    @Singular
    Map<String, ProjectSourceSet> projects;

    public Optional<ProjectSourceSet> getProject(String name) {
        return Optional.ofNullable(projects.get(name));
    }

    public ProjectSourceSet requireProject(String name) {
        return getProject(name)
                .orElseThrow(() -> new IllegalArgumentException("No sources loaded for project '" + name + "'"));
    }
}

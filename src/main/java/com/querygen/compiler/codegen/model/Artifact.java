package com.querygen.compiler.codegen.model;

import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A generated file held in memory: path relative to the project's output directory plus contents.
 */
@Value
@Builder(toBuilder = true)
public class Artifact {

    @NonNull
    Path path;

    @NonNull
    String contents;

    @NonNull
    ArtifactKind kind;

    /** Operation or fragment the artifact was generated for; null for project-level artifacts. */
    String definitionName;
}

package com.querygen.compiler.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Resolved configuration of one project. All paths are absolute.
 */
@Value
@Builder(toBuilder = true)
public class ProjectConfig {

    @NonNull
    String name;

    /** Base schema file or directory of {@code .graphql} files. */
    @NonNull
    Path schema;

    /** Project-specific schema extension files or directories. */
    @Singular
    List<Path> schemaExtensions;

    /** Directories holding the project's documents. */
    @Singular
    List<Path> sources;

    /** Project whose documents (and fragments) this project may reference. */
    String base;

    /** Directory artifacts are written to. */
    @NonNull
    Path output;

    @NonNull
    @Builder.Default
    ArtifactLanguage language = ArtifactLanguage.TYPESCRIPT;

    PersistConfig persist;

    public Optional<String> getBaseProject() {
        return Optional.ofNullable(base);
    }

    public Optional<PersistConfig> getPersistConfig() {
        return Optional.ofNullable(persist);
    }
}

package com.querygen.compiler.codegen.model;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Complete output of one project's generation stage. Paths are unique.
 */
public final class ArtifactSet {

    private final List<Artifact> artifacts;

    public ArtifactSet(List<Artifact> artifacts) {
        Set<Path> paths = new HashSet<>();
        for (Artifact artifact : artifacts) {
            if (!paths.add(artifact.getPath())) {
                throw new IllegalArgumentException("Two artifacts share the path " + artifact.getPath());
            }
        }
        this.artifacts = List.copyOf(artifacts);
    }

    public static ArtifactSet empty() {
        return new ArtifactSet(List.of());
    }

    public List<Artifact> getArtifacts() {
        return artifacts;
    }

    public long count(ArtifactKind kind) {
        return artifacts.stream().filter(a -> a.getKind() == kind).count();
    }

    public int size() {
        return artifacts.size();
    }

    public boolean isEmpty() {
        return artifacts.isEmpty();
    }
}

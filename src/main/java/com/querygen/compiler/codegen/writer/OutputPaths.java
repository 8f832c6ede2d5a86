package com.querygen.compiler.codegen.writer;

import java.nio.file.Path;
import java.util.List;

import com.querygen.compiler.codegen.model.Artifact;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.ArtifactWriteException;

final class OutputPaths {

    private OutputPaths() {
    }

    /**
     * Absolute target of an artifact inside the project's output directory.
     *
     * @throws ArtifactWriteException if the artifact path escapes the output directory
     */
    static Path resolve(ProjectConfig project, Artifact artifact) {
        Path output = project.getOutput().toAbsolutePath().normalize();
        Path target = output.resolve(artifact.getPath()).normalize();
        if (!target.startsWith(output) || target.equals(output)) {
            throw new ArtifactWriteException(List.of("Artifact path " + artifact.getPath()
                    + " points outside the output directory " + output));
        }
        return target;
    }
}

package com.querygen.compiler.codegen;

import java.util.concurrent.CompletableFuture;

import com.querygen.compiler.codegen.model.ArtifactSet;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.ArtifactGenerationException;
import com.querygen.compiler.transform.TargetPrograms;

/**
 * Turns target programs into in-memory artifacts. Nothing is written to disk here.
 */
public interface ArtifactGenerator {

    /**
     * May suspend on external work. The returned future completes exceptionally with an
     * {@link ArtifactGenerationException} naming the target and definition that failed.
     */
    CompletableFuture<ArtifactSet> generate(ProjectConfig project, TargetPrograms programs);
}

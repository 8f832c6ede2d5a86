package com.querygen.compiler.codegen.writer;

import com.querygen.compiler.codegen.model.ArtifactSet;
import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.ArtifactWriteException;

/**
 * Persists a generated artifact set.
 *
 * Not atomic: when a write fails midway, files written before the failure stay on disk.
 */
public interface ArtifactWriter {

    /**
     * @throws ArtifactWriteException if any artifact cannot be persisted
     */
    void write(CompilerConfig config, ProjectConfig project, ArtifactSet artifacts);
}

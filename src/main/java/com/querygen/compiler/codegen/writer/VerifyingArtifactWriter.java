package com.querygen.compiler.codegen.writer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.codegen.model.Artifact;
import com.querygen.compiler.codegen.model.ArtifactSet;
import com.querygen.compiler.codegen.util.FileWriteUtil;
import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.ArtifactWriteException;

/**
 * Writes nothing. Fails when any artifact on disk is missing or differs from the generated one.
 */
public class VerifyingArtifactWriter implements ArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(VerifyingArtifactWriter.class);

    @Override
    public void write(CompilerConfig config, ProjectConfig project, ArtifactSet artifacts) {
        List<String> problems = new ArrayList<>();
        for (Artifact artifact : artifacts.getArtifacts()) {
            Path target = OutputPaths.resolve(project, artifact);
            Optional<String> existing;
            try {
                existing = FileWriteUtil.readIfExists(target);
            } catch (IOException e) {
                throw new ArtifactWriteException("Failed to read " + target + ": " + e.getMessage(), e);
            }
            if (existing.isEmpty()) {
                problems.add("Missing artifact: " + target);
            } else if (!existing.get().equals(artifact.getContents())) {
                problems.add("Stale artifact: " + target);
            }
        }
        if (!problems.isEmpty()) {
            throw new ArtifactWriteException(problems);
        }
        log.info("[{}] all {} artifact(s) are up to date", project.getName(), artifacts.size());
    }
}

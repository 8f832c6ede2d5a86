package com.querygen.compiler.codegen.writer;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.codegen.model.Artifact;
import com.querygen.compiler.codegen.model.ArtifactSet;
import com.querygen.compiler.codegen.util.FileWriteUtil;
import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.ArtifactWriteException;

/**
 * Writes artifacts below the project's output directory. Files whose contents are already current are
 * left untouched.
 */
public class FileSystemArtifactWriter implements ArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactWriter.class);

    @Override
    public void write(CompilerConfig config, ProjectConfig project, ArtifactSet artifacts) {
        int written = 0;
        for (Artifact artifact : artifacts.getArtifacts()) {
            Path target = OutputPaths.resolve(project, artifact);
            try {
                if (FileWriteUtil.writeIfChanged(target, artifact.getContents())) {
                    written++;
                    log.debug("Wrote {}", target);
                }
            } catch (IOException e) {
                throw new ArtifactWriteException("Failed to write " + target + ": " + e.getMessage(), e);
            }
        }
        log.info("[{}] wrote {} artifact(s), {} unchanged", project.getName(), written, artifacts.size() - written);
    }
}

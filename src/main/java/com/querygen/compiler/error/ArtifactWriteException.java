package com.querygen.compiler.error;

import java.util.List;

/**
 * Persisting artifacts failed. Files written earlier in the same write stage may remain on disk.
 */
public class ArtifactWriteException extends BuildProjectException {

    private static final long serialVersionUID = 1L;

    public ArtifactWriteException(List<String> problems) {
        super(problems);
    }

    public ArtifactWriteException(String problem, Throwable cause) {
        super(problem, cause);
    }
}

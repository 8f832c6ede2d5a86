package com.querygen.compiler.error;

import lombok.Getter;

/**
 * Generation of one definition's artifact failed. Nothing is written for the project.
 */
@Getter
public class ArtifactGenerationException extends BuildProjectException {

    private static final long serialVersionUID = 1L;

    private final String target;
    private final String definitionName;

    public ArtifactGenerationException(String target, String definitionName, Throwable cause) {
        super("Failed to generate " + target + " artifact for '" + definitionName + "': " + describe(cause), cause);
        this.target = target;
        this.definitionName = definitionName;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

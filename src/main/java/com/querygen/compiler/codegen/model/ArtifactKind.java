package com.querygen.compiler.codegen.model;

/**
 * Categories of generated artifacts.
 */
public enum ArtifactKind {
    OPERATION,
    FRAGMENT,
    PERSISTED_QUERIES
}

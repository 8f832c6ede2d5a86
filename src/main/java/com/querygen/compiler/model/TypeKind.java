package com.querygen.compiler.model;

/**
 * Kinds of named schema types.
 */
public enum TypeKind {
    SCALAR,
    OBJECT,
    INTERFACE,
    UNION,
    ENUM,
    INPUT_OBJECT;

    public boolean isComposite() {
        return this == OBJECT || this == INTERFACE || this == UNION;
    }

    public boolean isAbstract() {
        return this == INTERFACE || this == UNION;
    }
}

package com.querygen.compiler.model;

import java.util.Locale;

/**
 * Kinds of executable operations.
 */
public enum OperationKind {
    QUERY,
    MUTATION,
    SUBSCRIPTION;

    /** Keyword as written in documents, e.g. {@code query}. */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Suffix an operation of this kind must carry in its name, e.g. {@code Query}. */
    public String nameSuffix() {
        String keyword = keyword();
        return Character.toUpperCase(keyword.charAt(0)) + keyword.substring(1);
    }

    public static OperationKind fromKeyword(String keyword) {
        for (OperationKind kind : values()) {
            if (kind.keyword().equals(keyword)) {
                return kind;
            }
        }
        return null;
    }
}

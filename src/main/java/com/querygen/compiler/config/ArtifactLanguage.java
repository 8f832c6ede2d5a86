package com.querygen.compiler.config;

import java.util.Locale;

/**
 * Output language of generated artifacts.
 */
public enum ArtifactLanguage {
    TYPESCRIPT("ts"),
    JAVASCRIPT("js");

    private final String extension;

    ArtifactLanguage(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /** Lower-case name, as used in config files and templates. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ArtifactLanguage fromId(String id) {
        for (ArtifactLanguage language : values()) {
            if (language.id().equalsIgnoreCase(id)) {
                return language;
            }
        }
        return null;
    }
}

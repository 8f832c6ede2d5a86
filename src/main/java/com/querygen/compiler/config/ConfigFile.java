package com.querygen.compiler.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw shape of {@code querygen.config.json}, bound by Jackson. Paths are still root-relative strings.
 */
@Data
@NoArgsConstructor
public class ConfigFile {

    private String root = ".";
    private boolean validate;
    private Integer maxSelectionDepth;
    private Map<String, ProjectEntry> projects = new LinkedHashMap<>();

    @Data
    @NoArgsConstructor
    public static class ProjectEntry {
        private String schema;
        private List<String> schemaExtensions = new ArrayList<>();
        private List<String> sources = new ArrayList<>();
        private String base;
        private String output;
        private String language;
        private PersistEntry persist;
    }

    @Data
    @NoArgsConstructor
    public static class PersistEntry {
        private boolean enabled = true;
        private String algorithm;
    }
}

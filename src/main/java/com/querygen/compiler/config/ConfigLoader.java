package com.querygen.compiler.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querygen.compiler.codegen.util.HashUtil;

/**
 * Reads {@code querygen.config.json} and resolves it into a {@link CompilerConfig}.
 *
 * Collects every problem in the file before failing.
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_FILE_NAME = "querygen.config.json";

    private final ObjectMapper objectMapper;

    public ConfigLoader() {
        this(new ObjectMapper());
    }

    public ConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CompilerConfig load(Path configFile) {
        String json;
        try {
            json = Files.readString(configFile);
        } catch (IOException e) {
            throw new ConfigException("Cannot read config file " + configFile + ": " + e.getMessage(), e);
        }
        Path baseDir = configFile.toAbsolutePath().normalize().getParent();
        return parse(json, baseDir);
    }

    /**
     * Parse config JSON; a relative {@code root} is resolved against {@code baseDir}.
     */
    public CompilerConfig parse(String json, Path baseDir) {
        ConfigFile file;
        try {
            file = objectMapper.readValue(json, ConfigFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed config: " + e.getOriginalMessage(), e);
        }
        return resolve(file, baseDir);
    }

    CompilerConfig resolve(ConfigFile file, Path baseDir) {
        List<String> errors = new ArrayList<>();
        Path root = baseDir.resolve(file.getRoot() == null ? "." : file.getRoot()).toAbsolutePath().normalize();

        if (file.getProjects() == null || file.getProjects().isEmpty()) {
            errors.add("At least one project must be configured under 'projects'.");
        }
        if (file.getMaxSelectionDepth() != null && file.getMaxSelectionDepth() < 1) {
            errors.add("maxSelectionDepth must be >= 1. Got: " + file.getMaxSelectionDepth());
        }

        CompilerConfig.CompilerConfigBuilder config = CompilerConfig.builder()
                .root(root)
                .validate(file.isValidate());
        if (file.getMaxSelectionDepth() != null) {
            config.maxSelectionDepth(file.getMaxSelectionDepth());
        }

        Map<String, ConfigFile.ProjectEntry> projects = file.getProjects() == null ? Map.of() : file.getProjects();
        for (Map.Entry<String, ConfigFile.ProjectEntry> entry : projects.entrySet()) {
            ProjectConfig project = resolveProject(entry.getKey(), entry.getValue(), root, projects.keySet(), errors);
            if (project != null) {
                config.project(entry.getKey(), project);
            }
        }

        checkBaseCycles(projects, errors);

        if (!errors.isEmpty()) {
            throw new ConfigException(errors);
        }

        CompilerConfig resolved = config.build();
        log.debug("Loaded config with {} project(s) rooted at {}", resolved.getProjects().size(), root);
        return resolved;
    }

    private ProjectConfig resolveProject(String name, ConfigFile.ProjectEntry entry, Path root,
                                         Set<String> projectNames, List<String> errors) {
        int errorCount = errors.size();
        if (entry == null) {
            errors.add("Project '" + name + "' has no settings.");
            return null;
        }
        if (isBlank(entry.getSchema())) {
            errors.add("Project '" + name + "' must declare a 'schema'.");
        }
        if (entry.getSources() == null || entry.getSources().isEmpty()) {
            errors.add("Project '" + name + "' must declare at least one entry in 'sources'.");
        }
        if (isBlank(entry.getOutput())) {
            errors.add("Project '" + name + "' must declare an 'output' directory.");
        }
        if (entry.getBase() != null) {
            if (entry.getBase().equals(name)) {
                errors.add("Project '" + name + "' cannot use itself as base.");
            } else if (!projectNames.contains(entry.getBase())) {
                errors.add("Project '" + name + "' has unknown base project '" + entry.getBase() + "'.");
            }
        }

        ArtifactLanguage language = ArtifactLanguage.TYPESCRIPT;
        if (entry.getLanguage() != null) {
            language = ArtifactLanguage.fromId(entry.getLanguage());
            if (language == null) {
                errors.add("Project '" + name + "' has unsupported language '" + entry.getLanguage()
                        + "'. Use typescript or javascript.");
            }
        }

        PersistConfig persist = null;
        if (entry.getPersist() != null && entry.getPersist().isEnabled()) {
            String algorithm = entry.getPersist().getAlgorithm() == null ? "MD5" : entry.getPersist().getAlgorithm();
            if (!HashUtil.isSupported(algorithm)) {
                errors.add("Project '" + name + "' has unsupported persist algorithm '" + algorithm + "'.");
            }
            persist = PersistConfig.builder().algorithm(algorithm).build();
        }

        if (errors.size() > errorCount) {
            return null;
        }

        ProjectConfig.ProjectConfigBuilder project = ProjectConfig.builder()
                .name(name)
                .schema(root.resolve(entry.getSchema()).normalize())
                .base(entry.getBase())
                .output(root.resolve(entry.getOutput()).normalize())
                .language(language)
                .persist(persist);
        entry.getSources().forEach(source -> project.source(root.resolve(source).normalize()));
        if (entry.getSchemaExtensions() != null) {
            entry.getSchemaExtensions().forEach(ext -> project.schemaExtension(root.resolve(ext).normalize()));
        }
        return project.build();
    }

    private static void checkBaseCycles(Map<String, ConfigFile.ProjectEntry> projects, List<String> errors) {
        for (String start : projects.keySet()) {
            Set<String> seen = new HashSet<>();
            String current = start;
            while (current != null && projects.get(current) != null) {
                if (!seen.add(current)) {
                    errors.add("Base project chain of '" + start + "' forms a cycle.");
                    break;
                }
                current = projects.get(current).getBase();
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}

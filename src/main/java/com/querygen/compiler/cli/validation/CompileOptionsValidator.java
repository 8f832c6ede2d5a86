package com.querygen.compiler.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.querygen.compiler.cli.exception.OptionsValidationException;
import com.querygen.compiler.cli.model.CompileOptions;
import com.querygen.compiler.cli.model.ValidatedCompileOptions;

public class CompileOptionsValidator {

    public ValidatedCompileOptions validate(CompileOptions o) {
        List<String> errors = new ArrayList<>();

        Path configFile = o.getConfigFile() == null
                ? null
                : o.getConfigFile().toAbsolutePath().normalize();
        if (configFile == null) {
            errors.add("Config file is required (--config / -c).");
        } else if (!Files.isRegularFile(configFile)) {
            errors.add("Config file does not exist or is not a file: " + configFile);
        }

        Set<String> projects = new LinkedHashSet<>();
        for (String project : o.getProjects()) {
            if (isBlank(project)) {
                errors.add("Project names must not be blank (--project / -p).");
            } else if (!projects.add(project.trim())) {
                errors.add("Project '" + project.trim() + "' is selected more than once.");
            }
        }

        if (o.getThreads() < 0) {
            errors.add("Thread count must be >= 0. Got: " + o.getThreads());
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        int threads = o.getThreads() == 0 ? Runtime.getRuntime().availableProcessors() : o.getThreads();
        return new ValidatedCompileOptions(configFile, List.copyOf(projects), o.isValidate(), threads);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}

package com.querygen.compiler.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "compile" command. No validation, no execution logic, no printing.
 */
@Getter
public class CompileOptions {

    @Option(names = { "--config", "-c" }, defaultValue = "querygen.config.json",
            description = "Path to the compiler configuration file (default: ${DEFAULT-VALUE})")
    private Path configFile;

    @Option(names = { "--project", "-p" },
            description = "Project to compile; repeat for several. Defaults to every configured project.")
    private List<String> projects = new ArrayList<>();

    @Option(names = { "--validate" },
            description = "Check that artifacts on disk are up to date instead of writing them")
    private boolean validate;

    @Option(names = { "--threads" }, defaultValue = "0",
            description = "Worker threads for project builds (0 = number of processors)")
    private int threads;
}

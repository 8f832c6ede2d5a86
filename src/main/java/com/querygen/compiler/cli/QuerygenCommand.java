package com.querygen.compiler.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; prints usage when no subcommand is given.
 */
@Command(
        name = "querygen",
        mixinStandardHelpOptions = true,
        version = "querygen 1.0.0",
        description = "Compiles GraphQL documents into runtime artifacts, one project at a time.",
        subcommands = CompileCommand.class
)
public class QuerygenCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}

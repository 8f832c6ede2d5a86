package com.querygen.compiler;

import com.querygen.compiler.cli.QuerygenCommand;

import picocli.CommandLine;

/**
 * Main entry point of the querygen compiler.
 */
public class CompilerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new QuerygenCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}

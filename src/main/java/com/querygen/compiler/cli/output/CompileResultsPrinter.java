package com.querygen.compiler.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.build.BuildOutcome;
import com.querygen.compiler.build.CompileResult;
import com.querygen.compiler.cli.model.ValidatedCompileOptions;
import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.error.ResolvedError;

/**
 * Responsible only for printing CLI output for the "compile" command.
 * No validation, no execution.
 */
public class CompileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CompileResultsPrinter.class);

    public void printBanner(ValidatedCompileOptions v, CompilerConfig config) {
        log.info("=================================================");
        log.info("querygen compiler");
        log.info("=================================================");
        log.info("Config File: {}", v.getConfigFile());
        log.info("Root: {}", config.getRoot());
        log.info("Projects: {}", v.getProjects().isEmpty() ? config.getProjects().keySet() : v.getProjects());
        log.info("Mode: {}", config.isValidate() ? "validate" : "write");
        log.info("Threads: {}", v.getThreads());
        log.info("=================================================");
    }

    public void printResult(CompileResult result) {
        if (!result.getParseErrors().isEmpty()) {
            log.error("Syntax errors:");
            for (ResolvedError error : result.getParseErrors()) {
                log.error("{}", error.format());
            }
            return;
        }

        for (BuildOutcome outcome : result.getOutcomes()) {
            if (outcome.isSuccess()) {
                log.info("{} ({} artifact(s))", outcome.getSummary().toLine(), outcome.getSummary().getArtifactCount());
            } else {
                printFailure(outcome);
            }
        }

        log.info("=================================================");
        if (result.isSuccess()) {
            log.info("COMPILATION SUCCESSFUL: {} project(s)", result.getOutcomes().size());
        } else {
            log.error("COMPILATION FAILED: {} of {} project(s) failed", result.failedCount(),
                    result.getOutcomes().size());
        }
        log.info("=================================================");
    }

    private void printFailure(BuildOutcome outcome) {
        String stage = outcome.getFailedStage() != null ? outcome.getFailedStage().getLabel() : "internal";
        log.error("[{}] failed at {}:", outcome.getProjectName(), stage);
        for (String line : outcome.describeFailures()) {
            log.error("  {}", line);
        }
    }
}

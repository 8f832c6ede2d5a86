package com.querygen.compiler.cli;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.build.BuildStages;
import com.querygen.compiler.build.CompileResult;
import com.querygen.compiler.build.Compiler;
import com.querygen.compiler.build.ProjectBuilder;
import com.querygen.compiler.cli.exception.OptionsValidationException;
import com.querygen.compiler.cli.model.CompileOptions;
import com.querygen.compiler.cli.model.ValidatedCompileOptions;
import com.querygen.compiler.cli.output.CompileResultsPrinter;
import com.querygen.compiler.cli.validation.CompileOptionsValidator;
import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.config.ConfigException;
import com.querygen.compiler.config.ConfigLoader;
import com.querygen.compiler.perf.Slf4jPerfLogger;
import com.querygen.compiler.state.CompilerStateLoader;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command compiling the configured projects.
 */
@Command(
        name = "compile",
        mixinStandardHelpOptions = true,
        description = "Compiles every selected project and writes (or verifies) its artifacts."
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Mixin
    private CompileOptions options;

    private final CompileOptionsValidator validator = new CompileOptionsValidator();
    private final CompileResultsPrinter printer = new CompileResultsPrinter();

    @Override
    public Integer call() {
        ValidatedCompileOptions validated;
        CompilerConfig config;
        try {
            validated = validator.validate(options);
            config = new ConfigLoader().load(validated.getConfigFile());
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        } catch (ConfigException e) {
            log.error("Invalid configuration:");
            e.getErrors().forEach(error -> log.error("  {}", error));
            return 1;
        }

        if (validated.isValidate()) {
            config = config.toBuilder().validate(true).build();
        }
        printer.printBanner(validated, config);

        ExecutorService executor = Executors.newFixedThreadPool(validated.getThreads());
        try {
            ProjectBuilder projectBuilder = new ProjectBuilder(BuildStages.defaults(config, executor),
                    new Slf4jPerfLogger());
            Compiler compiler = new Compiler(new CompilerStateLoader(), projectBuilder, executor);
            CompileResult result = compiler.compile(config, validated.getProjects());
            printer.printResult(result);
            return result.isSuccess() ? 0 : 1;
        } catch (ConfigException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        } catch (IOException e) {
            log.error("Failed to read sources: {}", e.getMessage(), e);
            return 1;
        } finally {
            executor.shutdown();
        }
    }
}

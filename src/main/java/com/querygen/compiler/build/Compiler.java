package com.querygen.compiler.build;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.config.ConfigException;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.StageResult;
import com.querygen.compiler.state.AstSets;
import com.querygen.compiler.state.CompilerState;
import com.querygen.compiler.state.CompilerStateLoader;

/**
 * Loads sources once, parses every document and builds the selected projects concurrently.
 */
public class Compiler {
    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final CompilerStateLoader stateLoader;
    private final ProjectBuilder projectBuilder;
    private final Executor executor;

    public Compiler(CompilerStateLoader stateLoader, ProjectBuilder projectBuilder, Executor executor) {
        this.stateLoader = stateLoader;
        this.projectBuilder = projectBuilder;
        this.executor = executor;
    }

    /**
     * Compile the named projects, or every project when {@code projectNames} is empty.
     *
     * @throws ConfigException if a named project is not configured
     * @throws IOException if sources cannot be read
     */
    public CompileResult compile(CompilerConfig config, Collection<String> projectNames) throws IOException {
        List<ProjectConfig> selected = select(config, projectNames);

        CompilerState state = stateLoader.load(config);
        StageResult<AstSets> parsed = AstSets.parse(state);
        if (!parsed.isOk()) {
            log.error("Found {} syntax error(s); no project was built", parsed.getErrors().size());
            CompileResult.CompileResultBuilder result = CompileResult.builder();
            parsed.getErrors().forEach(error -> result.parseError(error.withSources(state.getSources())));
            return result.build();
        }
        AstSets astSets = parsed.getValue();

        List<CompletableFuture<BuildOutcome>> builds = new ArrayList<>();
        for (ProjectConfig project : selected) {
            builds.add(CompletableFuture
                    .supplyAsync(() -> projectBuilder.buildProject(state, config, project, astSets,
                            state.getSources()), executor)
                    .thenCompose(Function.identity())
                    .exceptionally(failure -> internalError(project, failure)));
        }

        CompileResult.CompileResultBuilder result = CompileResult.builder();
        builds.forEach(build -> result.outcome(build.join()));
        return result.build();
    }

    private static List<ProjectConfig> select(CompilerConfig config, Collection<String> projectNames) {
        if (projectNames.isEmpty()) {
            return new ArrayList<>(config.getProjects().values());
        }
        List<ProjectConfig> selected = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String name : projectNames) {
            config.getProject(name).ifPresentOrElse(selected::add, () -> unknown.add(name));
        }
        if (!unknown.isEmpty()) {
            throw new ConfigException(unknown.stream().map(name -> "Unknown project '" + name + "'.").toList());
        }
        return selected;
    }

    /**
     * A defect in one project's build fails that project only.
     */
    private static BuildOutcome internalError(ProjectConfig project, Throwable failure) {
        Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
        log.error("[{}] internal compiler error", project.getName(), cause);
        return BuildOutcome.builder()
                .projectName(project.getName())
                .success(false)
                .problem("Internal compiler error: " + cause)
                .build();
    }
}

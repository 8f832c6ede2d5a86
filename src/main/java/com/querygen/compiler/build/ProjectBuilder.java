package com.querygen.compiler.build;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.codegen.model.ArtifactSet;
import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.ArtifactGenerationException;
import com.querygen.compiler.error.ArtifactWriteException;
import com.querygen.compiler.error.ResolvedError;
import com.querygen.compiler.error.SchemaBuildException;
import com.querygen.compiler.error.StageResult;
import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.ir.BuildIrResult;
import com.querygen.compiler.perf.PerfLogger;
import com.querygen.compiler.perf.TimingSpan;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.schema.Schema;
import com.querygen.compiler.source.Sources;
import com.querygen.compiler.state.AstSets;
import com.querygen.compiler.state.CompilerState;
import com.querygen.compiler.transform.TargetPrograms;

/**
 * Runs one project through schema, IR, program, validation, transforms, generation and writing.
 *
 * Each stage is timed under {@code "<stage> <project>"}. The first failing stage ends the build; its
 * errors are returned in a failed {@link BuildOutcome}. Artifacts are written only after generation has
 * produced the complete set. Holds no per-build state, so builds of different projects may run
 * concurrently on one instance.
 */
public class ProjectBuilder {
    private static final Logger log = LoggerFactory.getLogger(ProjectBuilder.class);

    private final BuildStages stages;
    private final PerfLogger perfLogger;

    public ProjectBuilder(BuildStages stages, PerfLogger perfLogger) {
        this.stages = stages;
        this.perfLogger = perfLogger;
    }

    /**
     * Build one project.
     *
     * @return a future of the outcome; it completes exceptionally only on defects (unexpected runtime
     *         exceptions in a stage or unresolvable error locations)
     */
    public CompletableFuture<BuildOutcome> buildProject(CompilerState state, CompilerConfig config,
                                                        ProjectConfig project, AstSets astSets, Sources sources) {
        try {
            return build(state, config, project, astSets, sources);
        } catch (RuntimeException e) {
            log.error("[{}] build aborted by an internal error", project.getName(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<BuildOutcome> build(CompilerState state, CompilerConfig config, ProjectConfig project,
                                                  AstSets astSets, Sources sources) {
        String name = project.getName();

        Schema schema;
        try (TimingSpan span = perfLogger.start(BuildStage.BUILD_SCHEMA.spanLabel(name))) {
            schema = stages.getSchemaBuilder().build(state, project);
        } catch (SchemaBuildException e) {
            return failed(name, BuildStage.BUILD_SCHEMA, List.of(), e.getProblems());
        }

        BuildIrResult ir;
        try (TimingSpan span = perfLogger.start(BuildStage.BUILD_IR.spanLabel(name))) {
            StageResult<BuildIrResult> result = stages.getIrBuilder().build(project, schema, astSets);
            if (!result.isOk()) {
                return failed(name, BuildStage.BUILD_IR, resolve(result.getErrors(), sources), List.of());
            }
            ir = result.getValue();
        }

        Program program;
        try (TimingSpan span = perfLogger.start(BuildStage.BUILD_PROGRAM.spanLabel(name))) {
            program = Program.fromDefinitions(schema, ir.getDefinitions());
        }

        try (TimingSpan span = perfLogger.start(BuildStage.VALIDATE.spanLabel(name))) {
            List<ValidationError> errors = stages.getValidator().validate(program);
            if (!errors.isEmpty()) {
                return failed(name, BuildStage.VALIDATE, resolve(errors, sources), List.of());
            }
        }

        TargetPrograms targets;
        try (TimingSpan span = perfLogger.start(BuildStage.APPLY_TRANSFORMS.spanLabel(name))) {
            targets = stages.getTransformPipeline().apply(program, ir.getBaseFragmentNames());
        }

        TimingSpan generateSpan = perfLogger.start(BuildStage.GENERATE_ARTIFACTS.spanLabel(name));
        CompletableFuture<ArtifactSet> generation;
        try {
            generation = stages.getArtifactGenerator().generate(project, targets);
        } catch (RuntimeException e) {
            generation = CompletableFuture.failedFuture(e);
        }

        return generation.handle((artifacts, failure) -> {
            generateSpan.stop();
            if (failure == null) {
                return write(config, project, targets, artifacts);
            }
            Throwable cause = unwrap(failure);
            if (cause instanceof ArtifactGenerationException generationFailure) {
                log.error("[{}] {}", name, generationFailure.getMessage());
                return BuildOutcome.failure(name, BuildStage.GENERATE_ARTIFACTS, List.of(),
                        generationFailure.getProblems());
            }
            throw new CompletionException(cause);
        });
    }

    private BuildOutcome write(CompilerConfig config, ProjectConfig project, TargetPrograms targets,
                               ArtifactSet artifacts) {
        String name = project.getName();
        try (TimingSpan span = perfLogger.start(BuildStage.WRITE_ARTIFACTS.spanLabel(name))) {
            stages.getArtifactWriter().write(config, project, artifacts);
        } catch (ArtifactWriteException e) {
            log.error("[{}] {}", name, e.getMessage());
            return BuildOutcome.failure(name, BuildStage.WRITE_ARTIFACTS, List.of(), e.getProblems());
        }

        ProjectSummary summary = ProjectSummary.builder()
                .projectName(name)
                .readerCount(targets.getReader().documentCount())
                .normalizationCount(targets.getNormalization().documentCount())
                .operationTextCount(targets.getOperationText().documentCount())
                .artifactCount(artifacts.size())
                .build();
        log.info(summary.toLine());
        return BuildOutcome.success(summary);
    }

    private CompletableFuture<BuildOutcome> failed(String projectName, BuildStage stage, List<ResolvedError> errors,
                                                   List<String> problems) {
        log.error("[{}] {} failed with {} error(s)", projectName, stage.getLabel(), errors.size() + problems.size());
        return CompletableFuture.completedFuture(BuildOutcome.failure(projectName, stage, errors, problems));
    }

    /**
     * @throws IllegalStateException if an error points outside the known sources
     */
    private static List<ResolvedError> resolve(List<ValidationError> errors, Sources sources) {
        return errors.stream().map(error -> error.withSources(sources)).toList();
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

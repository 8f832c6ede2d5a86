package com.querygen.compiler.codegen;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.querygen.compiler.codegen.ast.AstJsonSerializer;
import com.querygen.compiler.codegen.ast.RequestParameters;
import com.querygen.compiler.codegen.model.Artifact;
import com.querygen.compiler.codegen.model.ArtifactKind;
import com.querygen.compiler.codegen.model.ArtifactSet;
import com.querygen.compiler.codegen.persist.HashingOperationPersister;
import com.querygen.compiler.codegen.persist.OperationPersister;
import com.querygen.compiler.codegen.print.GraphQLPrinter;
import com.querygen.compiler.codegen.util.HashUtil;
import com.querygen.compiler.config.PersistConfig;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.ArtifactGenerationException;
import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.Fragment;
import com.querygen.compiler.ir.Operation;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.transform.TargetPrograms;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders one artifact per operation of the normalization program and one per fragment of the reader
 * program, using the FreeMarker templates under {@code /templates}.
 *
 * When the project persists operations, each operation text is handed to an {@link OperationPersister}
 * and the artifact carries the returned id; a {@code persisted_queries.json} artifact maps ids to texts.
 */
public class TemplateArtifactGenerator implements ArtifactGenerator {
    private static final Logger log = LoggerFactory.getLogger(TemplateArtifactGenerator.class);

    public static final String PERSISTED_QUERIES_FILE = "persisted_queries.json";

    private static final String OPERATION_TEMPLATE = "operation.ftl";
    private static final String FRAGMENT_TEMPLATE = "fragment.ftl";

    private final Configuration freemarkerConfig;
    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final GraphQLPrinter printer = new GraphQLPrinter();
    private final Function<PersistConfig, OperationPersister> persisterFactory;

    /**
     * Persisted operations are hashed on {@code executor}.
     */
    public TemplateArtifactGenerator(Executor executor) {
        this((PersistConfig persist) -> new HashingOperationPersister(persist.getAlgorithm(), executor));
    }

    public TemplateArtifactGenerator(Function<PersistConfig, OperationPersister> persisterFactory) {
        this.freemarkerConfig = createFreemarkerConfig();
        this.mapper = new ObjectMapper();
        this.serializer = new AstJsonSerializer(mapper);
        this.persisterFactory = persisterFactory;
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    @Override
    public CompletableFuture<ArtifactSet> generate(ProjectConfig project, TargetPrograms programs) {
        OperationPersister persister;
        try {
            persister = project.getPersistConfig().map(persisterFactory).orElse(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new ArtifactGenerationException(TargetPrograms.OPERATION_TEXT, project.getName(), e));
        }

        Program normalization = programs.getNormalization();
        Program reader = programs.getReader();
        Program operationText = programs.getOperationText();

        List<CompletableFuture<Artifact>> operations = new ArrayList<>();
        Map<String, String> persisted = new TreeMap<>();
        for (Operation operation : normalization.getOperations()) {
            operations.add(operationArtifact(project, reader, operationText, operation, persister, persisted));
        }

        List<Artifact> fragments = new ArrayList<>();
        for (Fragment fragment : reader.getFragments()) {
            try {
                fragments.add(fragmentArtifact(project, reader, fragment));
            } catch (ArtifactGenerationException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        return CompletableFuture.allOf(operations.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, failure) -> {
                    if (failure != null) {
                        throw failure instanceof CompletionException
                                ? (CompletionException) failure
                                : new CompletionException(failure);
                    }
                    List<Artifact> artifacts = new ArrayList<>();
                    operations.forEach(future -> artifacts.add(future.join()));
                    artifacts.addAll(fragments);
                    if (persister != null) {
                        artifacts.add(persistedQueries(persisted));
                    }
                    log.debug("Project {}: generated {} artifact(s)", project.getName(), artifacts.size());
                    return new ArtifactSet(artifacts);
                });
    }

    private CompletableFuture<Artifact> operationArtifact(ProjectConfig project, Program reader,
                                                         Program operationText, Operation normalization,
                                                         OperationPersister persister,
                                                         Map<String, String> persisted) {
        String name = normalization.getName();
        String text;
        ExecutableDefinition readerDefinition;
        try {
            Operation printable = operationText.getOperations().stream()
                    .filter(op -> op.getName().equals(name))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("Operation text program lacks " + name));
            text = printer.printOperationText(operationText, printable);
            readerDefinition = reader.get(name)
                    .orElseThrow(() -> new IllegalStateException("Reader program lacks " + name));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new ArtifactGenerationException(TargetPrograms.OPERATION_TEXT, name, e));
        }

        CompletableFuture<String> id;
        if (persister == null) {
            id = CompletableFuture.completedFuture(null);
        } else {
            id = persistSafely(persister, text).handle((persistedId, failure) -> {
                if (failure != null) {
                    throw new ArtifactGenerationException(TargetPrograms.OPERATION_TEXT, name, unwrap(failure));
                }
                if (persistedId == null) {
                    throw new ArtifactGenerationException(TargetPrograms.OPERATION_TEXT, name,
                            new IllegalStateException("Persister returned no id"));
                }
                synchronized (persisted) {
                    persisted.put(persistedId, text);
                }
                return persistedId;
            });
        }

        return id.thenApply(persistedId -> attempt(TargetPrograms.NORMALIZATION, name, () -> {
            RequestParameters params = RequestParameters.builder()
                    .name(name)
                    .operationKind(normalization.getKind())
                    .cacheId(persistedId != null ? persistedId : HashUtil.md5(text))
                    .id(persistedId)
                    .text(persistedId != null ? null : text)
                    .build();
            String ast = serializer.write(serializer.request(reader.getSchema(), readerDefinition, normalization, params));

            Map<String, Object> model = templateModel(project, name, ast, HashUtil.md5(text));
            model.put("operationKind", normalization.getKind().keyword());
            return Artifact.builder()
                    .path(artifactPath(project, name))
                    .contents(render(OPERATION_TEMPLATE, model))
                    .kind(ArtifactKind.OPERATION)
                    .definitionName(name)
                    .build();
        }));
    }

    private Artifact fragmentArtifact(ProjectConfig project, Program reader, Fragment fragment) {
        return attempt(TargetPrograms.READER, fragment.getName(), () -> {
            String ast = serializer.write(serializer.readerFragment(reader.getSchema(), fragment));
            Map<String, Object> model = templateModel(project, fragment.getName(), ast,
                    HashUtil.md5(printer.print(fragment)));
            return Artifact.builder()
                    .path(artifactPath(project, fragment.getName()))
                    .contents(render(FRAGMENT_TEMPLATE, model))
                    .kind(ArtifactKind.FRAGMENT)
                    .definitionName(fragment.getName())
                    .build();
        });
    }

    private Artifact persistedQueries(Map<String, String> persisted) {
        Map<String, String> sorted;
        synchronized (persisted) {
            sorted = new TreeMap<>(persisted);
        }
        return attempt(TargetPrograms.OPERATION_TEXT, PERSISTED_QUERIES_FILE, () -> Artifact.builder()
                .path(Path.of(PERSISTED_QUERIES_FILE))
                .contents(serializer.write(mapper.valueToTree(sorted)) + "\n")
                .kind(ArtifactKind.PERSISTED_QUERIES)
                .build());
    }

    private static CompletableFuture<String> persistSafely(OperationPersister persister, String text) {
        try {
            return persister.persist(text);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Map<String, Object> templateModel(ProjectConfig project, String name, String ast, String sourceHash) {
        Map<String, Object> model = new HashMap<>();
        model.put("name", name);
        model.put("ast", ast);
        model.put("sourceHash", sourceHash);
        model.put("language", project.getLanguage().id());
        return model;
    }

    private static Path artifactPath(ProjectConfig project, String definitionName) {
        return Path.of(definitionName + ".graphql." + project.getLanguage().getExtension());
    }

    private String render(String templateName, Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render " + templateName, e);
        }
    }

    private static <T> T attempt(String target, String definitionName, Supplier<T> work) {
        try {
            return work.get();
        } catch (ArtifactGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ArtifactGenerationException(target, definitionName, e);
        }
    }

    private static Throwable unwrap(Throwable failure) {
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }
}

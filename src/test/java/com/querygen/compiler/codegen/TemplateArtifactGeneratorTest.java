package com.querygen.compiler.codegen;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querygen.compiler.TestCompilerState;
import com.querygen.compiler.codegen.model.Artifact;
import com.querygen.compiler.codegen.model.ArtifactKind;
import com.querygen.compiler.codegen.model.ArtifactSet;
import com.querygen.compiler.codegen.util.HashUtil;
import com.querygen.compiler.config.ArtifactLanguage;
import com.querygen.compiler.config.PersistConfig;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.ArtifactGenerationException;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.state.CompilerState;
import com.querygen.compiler.transform.DefaultTransformPipeline;
import com.querygen.compiler.transform.TargetPrograms;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TemplateArtifactGeneratorTest {

    private static final String DOCUMENT = """
            query UserQuery($id: ID!) {
              user(id: $id) { name ...UserFragment }
            }
            fragment UserFragment on User { role }
            """;

    private final Executor direct = Runnable::run;
    private final TemplateArtifactGenerator generator = new TemplateArtifactGenerator(direct);

    @Test
    void testGeneratesOneArtifactPerOperationAndReaderFragment() {
        ArtifactSet artifacts = generator.generate(TestCompilerState.project("app"), targets()).join();

        assertThat(artifacts.getArtifacts()).extracting(Artifact::getPath)
                .containsExactly(Path.of("UserQuery.graphql.ts"), Path.of("UserFragment.graphql.ts"));
        assertThat(artifacts.count(ArtifactKind.OPERATION)).isEqualTo(1);
        assertThat(artifacts.count(ArtifactKind.FRAGMENT)).isEqualTo(1);

        Artifact operation = artifacts.getArtifacts().get(0);
        assertThat(operation.getDefinitionName()).isEqualTo("UserQuery");
        assertThat(operation.getContents())
                .contains("@generated")
                .contains("import type { ConcreteRequest } from 'querygen-runtime';")
                .contains("\"Request\"")
                .contains("query UserQuery")
                .contains("export default node;");

        assertThat(artifacts.getArtifacts().get(1).getContents())
                .contains("import type { ReaderFragment } from 'querygen-runtime';")
                .contains("\"UserFragment\"");
    }

    @Test
    void testJavascriptArtifactsUseCommonJs() {
        ProjectConfig project = TestCompilerState.project("app").toBuilder()
                .language(ArtifactLanguage.JAVASCRIPT)
                .build();

        ArtifactSet artifacts = generator.generate(project, targets()).join();

        assertThat(artifacts.getArtifacts()).extracting(Artifact::getPath)
                .containsExactly(Path.of("UserQuery.graphql.js"), Path.of("UserFragment.graphql.js"));
        assertThat(artifacts.getArtifacts()).allSatisfy(a -> assertThat(a.getContents()).contains("module.exports"));
    }

    @Test
    void testOutputIsDeterministic() {
        TargetPrograms targets = targets();

        ArtifactSet first = generator.generate(TestCompilerState.project("app"), targets).join();
        ArtifactSet second = generator.generate(TestCompilerState.project("app"), targets).join();

        assertThat(second.getArtifacts()).containsExactlyElementsOf(first.getArtifacts());
    }

    @Test
    void testPersistedOperationsCarryTheirIdInsteadOfText() throws Exception {
        ProjectConfig project = TestCompilerState.project("app").toBuilder()
                .persist(PersistConfig.builder().algorithm("MD5").build())
                .build();

        ArtifactSet artifacts = generator.generate(project, targets()).join();

        assertThat(artifacts.count(ArtifactKind.PERSISTED_QUERIES)).isEqualTo(1);
        Artifact persisted = artifacts.getArtifacts().stream()
                .filter(a -> a.getKind() == ArtifactKind.PERSISTED_QUERIES)
                .findFirst()
                .orElseThrow();
        assertThat(persisted.getPath()).isEqualTo(Path.of(TemplateArtifactGenerator.PERSISTED_QUERIES_FILE));

        JsonNode queries = new ObjectMapper().readTree(persisted.getContents());
        assertThat(queries.size()).isEqualTo(1);
        Iterator<Map.Entry<String, JsonNode>> entries = queries.fields();
        Map.Entry<String, JsonNode> entry = entries.next();
        assertThat(entry.getKey()).isEqualTo(HashUtil.md5(entry.getValue().asText()));
        assertThat(entry.getValue().asText()).startsWith("query UserQuery");

        Artifact operation = artifacts.getArtifacts().get(0);
        assertThat(operation.getContents()).contains(entry.getKey());
    }

    @Test
    void testFailingPersisterFailsGenerationWithDefinitionName() {
        ProjectConfig project = TestCompilerState.project("app").toBuilder()
                .persist(PersistConfig.builder().algorithm("MD5").build())
                .build();
        TemplateArtifactGenerator failing = new TemplateArtifactGenerator(
                (PersistConfig persist) -> text -> CompletableFuture.failedFuture(
                        new IllegalStateException("store unavailable")));

        CompletableFuture<ArtifactSet> result = failing.generate(project, targets());

        assertThatThrownBy(result::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(ArtifactGenerationException.class)
                .hasMessageContaining("UserQuery")
                .hasMessageContaining("store unavailable");
        ArtifactGenerationException cause = (ArtifactGenerationException) catchThrowable(result::join).getCause();
        assertThat(cause.getTarget()).isEqualTo(TargetPrograms.OPERATION_TEXT);
        assertThat(cause.getDefinitionName()).isEqualTo("UserQuery");
    }

    @Test
    void testPersisterWithoutIdFailsGenerationWithDefinitionName() {
        ProjectConfig project = TestCompilerState.project("app").toBuilder()
                .persist(PersistConfig.builder().algorithm("MD5").build())
                .build();
        TemplateArtifactGenerator silent = new TemplateArtifactGenerator(
                (PersistConfig persist) -> text -> CompletableFuture.completedFuture(null));

        Throwable thrown = catchThrowable(() -> silent.generate(project, targets()).join());

        assertThat(thrown).isInstanceOf(CompletionException.class);
        assertThat(thrown.getCause())
                .isInstanceOf(ArtifactGenerationException.class)
                .hasMessageContaining("UserQuery")
                .hasMessageContaining("Persister returned no id");
        assertThat(((ArtifactGenerationException) thrown.getCause()).getTarget())
                .isEqualTo(TargetPrograms.OPERATION_TEXT);
    }

    private static TargetPrograms targets() {
        CompilerState state = TestCompilerState.single("src/User.graphql", DOCUMENT);
        Program program = TestCompilerState.program(state, TestCompilerState.project("app"));
        return DefaultTransformPipeline.standard().apply(program, Set.of());
    }
}

package com.querygen.compiler.state;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.StageResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class CompilerStateLoaderTest {

    @TempDir
    Path tempDir;

    private final CompilerStateLoader loader = new CompilerStateLoader();

    @Test
    void testDiscoversGraphQLFilesSortedAndSharesSchemaText() throws IOException {
        write("schema/schema.graphql", "type Query { a: Int }");
        write("web/src/b/Second.graphql", "query SecondQuery { a }");
        write("web/src/a/First.gql", "query FirstQuery { a }");
        write("web/src/notes.txt", "ignored");
        write("admin/Admin.graphql", "query AdminQuery { a }");

        CompilerConfig config = CompilerConfig.builder()
                .root(tempDir)
                .project("web", project("web", "web/src"))
                .project("admin", project("admin", "admin"))
                .build();

        CompilerState state = loader.load(config);

        assertThat(state.requireProject("web").getSchemaKeys()).containsExactly("schema/schema.graphql");
        assertThat(state.requireProject("web").getDocumentKeys())
                .containsExactly("web/src/a/First.gql", "web/src/b/Second.graphql");
        assertThat(state.requireProject("admin").getDocumentKeys()).containsExactly("admin/Admin.graphql");
        assertThat(state.getSources().size()).isEqualTo(4);
        assertThat(state.getSources().get("web/src/a/First.gql")).contains("query FirstQuery { a }");
    }

    @Test
    void testMissingSourceDirectoryFails() {
        CompilerConfig config = CompilerConfig.builder()
                .root(tempDir)
                .project("web", project("web", "does/not/exist"))
                .build();

        assertThatThrownBy(() -> loader.load(config))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Path does not exist");
    }

    @Test
    void testParseCollectsSyntaxErrorsFromAllFiles() throws IOException {
        write("schema/schema.graphql", "type Query { a: Int }");
        write("web/src/Bad1.graphql", "query Bad1Query { a ");
        write("web/src/Bad2.graphql", "query Bad2Query { }");
        write("web/src/Good.graphql", "query GoodQuery { a }");
        CompilerConfig config = CompilerConfig.builder()
                .root(tempDir)
                .project("web", project("web", "web/src"))
                .build();

        StageResult<AstSets> parsed = AstSets.parse(loader.load(config));

        assertThat(parsed.isOk()).isFalse();
        assertThat(parsed.getErrors()).hasSize(2);
        assertThat(parsed.getErrors()).extracting(e -> e.getLocations().get(0).getSourceKey())
                .containsExactly("web/src/Bad1.graphql", "web/src/Bad2.graphql");
    }

    private ProjectConfig project(String name, String sources) {
        return ProjectConfig.builder()
                .name(name)
                .schema(tempDir.resolve("schema"))
                .source(tempDir.resolve(sources))
                .output(tempDir.resolve("out").resolve(name))
                .build();
    }

    private void write(String relative, String text) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text);
    }
}

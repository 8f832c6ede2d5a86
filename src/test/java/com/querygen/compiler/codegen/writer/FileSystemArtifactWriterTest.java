package com.querygen.compiler.codegen.writer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import com.querygen.compiler.codegen.model.Artifact;
import com.querygen.compiler.codegen.model.ArtifactKind;
import com.querygen.compiler.codegen.model.ArtifactSet;
import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.ArtifactWriteException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class FileSystemArtifactWriterTest {

    @TempDir
    Path tempDir;

    private final FileSystemArtifactWriter writer = new FileSystemArtifactWriter();

    @Test
    void testWritesArtifactsBelowOutputDirectory() throws IOException {
        ProjectConfig project = project();

        writer.write(config(), project, new ArtifactSet(List.of(
                artifact("UserQuery.graphql.ts", "query"),
                artifact("nested/UserFragment.graphql.ts", "fragment"))));

        assertThat(tempDir.resolve("out/UserQuery.graphql.ts")).hasContent("query");
        assertThat(tempDir.resolve("out/nested/UserFragment.graphql.ts")).hasContent("fragment");
    }

    @Test
    void testLeavesUnchangedFilesUntouched() throws IOException {
        ProjectConfig project = project();
        ArtifactSet artifacts = new ArtifactSet(List.of(artifact("UserQuery.graphql.ts", "query")));
        writer.write(config(), project, artifacts);
        Path file = tempDir.resolve("out/UserQuery.graphql.ts");
        FileTime old = FileTime.fromMillis(1_000_000L);
        Files.setLastModifiedTime(file, old);

        writer.write(config(), project, artifacts);

        assertThat(Files.getLastModifiedTime(file)).isEqualTo(old);
    }

    @Test
    void testRejectsPathsOutsideOutputDirectory() {
        ArtifactSet artifacts = new ArtifactSet(List.of(artifact("../escape.ts", "x")));

        assertThatThrownBy(() -> writer.write(config(), project(), artifacts))
                .isInstanceOf(ArtifactWriteException.class)
                .hasMessageContaining("outside the output directory");
        assertThat(tempDir.resolve("escape.ts")).doesNotExist();
    }

    @Test
    void testIoFailureBecomesWriteException() throws IOException {
        Files.createDirectories(tempDir.resolve("out/UserQuery.graphql.ts"));
        ArtifactSet artifacts = new ArtifactSet(List.of(artifact("UserQuery.graphql.ts", "query")));

        assertThatThrownBy(() -> writer.write(config(), project(), artifacts))
                .isInstanceOf(ArtifactWriteException.class)
                .hasMessageContaining("Failed to write");
    }

    private ProjectConfig project() {
        return ProjectConfig.builder()
                .name("app")
                .schema(tempDir.resolve("schema.graphql"))
                .output(tempDir.resolve("out"))
                .build();
    }

    private CompilerConfig config() {
        return CompilerConfig.builder().root(tempDir).build();
    }

    static Artifact artifact(String path, String contents) {
        return Artifact.builder()
                .path(Path.of(path))
                .contents(contents)
                .kind(ArtifactKind.OPERATION)
                .definitionName("UserQuery")
                .build();
    }
}

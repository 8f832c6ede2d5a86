package com.querygen.compiler.codegen.writer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.querygen.compiler.codegen.model.ArtifactSet;
import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.ArtifactWriteException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static com.querygen.compiler.codegen.writer.FileSystemArtifactWriterTest.artifact;
import static org.assertj.core.api.Assertions.*;

class VerifyingArtifactWriterTest {

    @TempDir
    Path tempDir;

    private final VerifyingArtifactWriter writer = new VerifyingArtifactWriter();

    @Test
    void testPassesWhenEverythingIsCurrent() throws IOException {
        Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(tempDir.resolve("out/A.graphql.ts"), "a");

        assertThatCode(() -> writer.write(config(), project(),
                new ArtifactSet(List.of(artifact("A.graphql.ts", "a"))))).doesNotThrowAnyException();
    }

    @Test
    void testReportsEveryMissingAndStaleArtifactWithoutWriting() throws IOException {
        Files.createDirectories(tempDir.resolve("out"));
        Files.writeString(tempDir.resolve("out/A.graphql.ts"), "old");
        ArtifactSet artifacts = new ArtifactSet(List.of(
                artifact("A.graphql.ts", "new"),
                artifact("B.graphql.ts", "b")));

        ArtifactWriteException e = catchThrowableOfType(() -> writer.write(config(), project(), artifacts),
                ArtifactWriteException.class);

        assertThat(e.getProblems()).containsExactly(
                "Stale artifact: " + tempDir.resolve("out/A.graphql.ts").toAbsolutePath().normalize(),
                "Missing artifact: " + tempDir.resolve("out/B.graphql.ts").toAbsolutePath().normalize());
        assertThat(tempDir.resolve("out/A.graphql.ts")).hasContent("old");
        assertThat(tempDir.resolve("out/B.graphql.ts")).doesNotExist();
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
}

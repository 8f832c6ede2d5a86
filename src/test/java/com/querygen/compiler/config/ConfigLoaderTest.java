package com.querygen.compiler.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void testLoadsProjectsWithPathsResolvedAgainstRoot() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
                {
                  "root": "app",
                  "maxSelectionDepth": 8,
                  "projects": {
                    "common": {
                      "schema": "schema/schema.graphql",
                      "sources": ["common"],
                      "output": "generated/common"
                    },
                    "web": {
                      "schema": "schema/schema.graphql",
                      "schemaExtensions": ["web/extensions"],
                      "sources": ["web/src"],
                      "base": "common",
                      "output": "generated/web",
                      "language": "javascript",
                      "persist": { "algorithm": "SHA-256" }
                    }
                  }
                }
                """);

        CompilerConfig config = loader.load(configFile);

        Path root = tempDir.resolve("app").toAbsolutePath().normalize();
        assertThat(config.getRoot()).isEqualTo(root);
        assertThat(config.getMaxSelectionDepth()).isEqualTo(8);
        assertThat(config.isValidate()).isFalse();
        assertThat(config.getProjects().keySet()).containsExactly("common", "web");

        ProjectConfig web = config.getProject("web").orElseThrow();
        assertThat(web.getSchema()).isEqualTo(root.resolve("schema/schema.graphql"));
        assertThat(web.getSchemaExtensions()).containsExactly(root.resolve("web/extensions"));
        assertThat(web.getSources()).containsExactly(root.resolve("web/src"));
        assertThat(web.getBaseProject()).contains("common");
        assertThat(web.getLanguage()).isEqualTo(ArtifactLanguage.JAVASCRIPT);
        assertThat(web.getPersistConfig()).map(PersistConfig::getAlgorithm).contains("SHA-256");

        ProjectConfig common = config.getProject("common").orElseThrow();
        assertThat(common.getLanguage()).isEqualTo(ArtifactLanguage.TYPESCRIPT);
        assertThat(common.getPersistConfig()).isEmpty();
    }

    @Test
    void testDefaultsApplyWhenOmitted() {
        CompilerConfig config = loader.parse("""
                { "projects": { "web": { "schema": "s.graphql", "sources": ["src"], "output": "out" } } }
                """, tempDir);

        assertThat(config.getRoot()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(config.getMaxSelectionDepth()).isEqualTo(CompilerConfig.DEFAULT_MAX_SELECTION_DEPTH);
    }

    @Test
    void testCollectsEveryConfigProblem() {
        ConfigException e = catchThrowableOfType(() -> loader.parse("""
                {
                  "maxSelectionDepth": 0,
                  "projects": {
                    "web": { "sources": [], "base": "web", "language": "kotlin" },
                    "admin": { "schema": "s.graphql", "sources": ["a"], "output": "o", "base": "ghost",
                               "persist": { "algorithm": "NOPE-1" } }
                  }
                }
                """, tempDir), ConfigException.class);

        assertThat(e.getErrors()).containsExactlyInAnyOrder(
                "maxSelectionDepth must be >= 1. Got: 0",
                "Project 'web' must declare a 'schema'.",
                "Project 'web' must declare at least one entry in 'sources'.",
                "Project 'web' must declare an 'output' directory.",
                "Project 'web' cannot use itself as base.",
                "Project 'web' has unsupported language 'kotlin'. Use typescript or javascript.",
                "Project 'admin' has unknown base project 'ghost'.",
                "Project 'admin' has unsupported persist algorithm 'NOPE-1'.",
                "Base project chain of 'web' forms a cycle.");
    }

    @Test
    void testBaseCyclesAreRejected() {
        assertThatThrownBy(() -> loader.parse("""
                {
                  "projects": {
                    "a": { "schema": "s", "sources": ["a"], "output": "oa", "base": "b" },
                    "b": { "schema": "s", "sources": ["b"], "output": "ob", "base": "a" }
                  }
                }
                """, tempDir))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Base project chain of 'a' forms a cycle.");
    }

    @Test
    void testMalformedJsonAndMissingFile() {
        assertThatThrownBy(() -> loader.parse("{ projects: ", tempDir))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("Malformed config");
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.json")))
                .isInstanceOf(ConfigException.class)
                .hasMessageStartingWith("Cannot read config file");
    }
}

package com.querygen.compiler.state;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.config.CompilerConfig;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.source.Sources;

/**
 * Discovers and reads schema, extension and document files for every configured project.
 *
 * Source keys are root-relative paths with forward slashes. A file shared by several projects is
 * read once.
 */
public class CompilerStateLoader {
    private static final Logger log = LoggerFactory.getLogger(CompilerStateLoader.class);

    private static final List<String> GRAPHQL_EXTENSIONS = List.of(".graphql", ".graphqls", ".gql");

    public CompilerState load(CompilerConfig config) throws IOException {
        Map<String, String> texts = new LinkedHashMap<>();
        CompilerState.CompilerStateBuilder state = CompilerState.builder();

        for (ProjectConfig project : config.getProjects().values()) {
            ProjectSourceSet.ProjectSourceSetBuilder sourceSet = ProjectSourceSet.builder()
                    .projectName(project.getName());

            for (Path file : discover(project.getSchema())) {
                sourceSet.schemaKey(read(config.getRoot(), file, texts));
            }
            for (Path extension : project.getSchemaExtensions()) {
                for (Path file : discover(extension)) {
                    sourceSet.extensionKey(read(config.getRoot(), file, texts));
                }
            }
            for (Path sourceDir : project.getSources()) {
                for (Path file : discover(sourceDir)) {
                    sourceSet.documentKey(read(config.getRoot(), file, texts));
                }
            }

            ProjectSourceSet built = sourceSet.build();
            log.info("Project {}: {} schema file(s), {} extension file(s), {} document(s)", project.getName(),
                    built.getSchemaKeys().size(), built.getExtensionKeys().size(), built.getDocumentKeys().size());
            state.project(project.getName(), built);
        }

        return state.sources(Sources.of(texts)).build();
    }

    /**
     * A file is returned as-is; a directory is walked recursively for GraphQL files, sorted by path.
     */
    List<Path> discover(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Path does not exist: " + path);
        }
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        List<Path> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(path)) {
            walk.filter(Files::isRegularFile)
                    .filter(this::isGraphQLFile)
                    .sorted()
                    .forEach(files::add);
        }
        return files;
    }

    private String read(Path root, Path file, Map<String, String> texts) throws IOException {
        String key = toSourceKey(root, file);
        if (!texts.containsKey(key)) {
            texts.put(key, Files.readString(file));
            log.debug("Read {}", key);
        }
        return key;
    }

    static String toSourceKey(Path root, Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        Path relative = absolute.startsWith(root) ? root.relativize(absolute) : absolute;
        return relative.toString().replace('\\', '/');
    }

    private boolean isGraphQLFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return GRAPHQL_EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}

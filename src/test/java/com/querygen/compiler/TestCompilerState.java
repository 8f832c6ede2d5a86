package com.querygen.compiler;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.ir.BuildIrResult;
import com.querygen.compiler.ir.TypeCheckingIrBuilder;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.schema.ExtendingSchemaBuilder;
import com.querygen.compiler.schema.Schema;
import com.querygen.compiler.source.Sources;
import com.querygen.compiler.state.AstSets;
import com.querygen.compiler.state.CompilerState;
import com.querygen.compiler.state.ProjectSourceSet;

/**
 * Builds a {@link CompilerState} from in-memory texts so stage tests need no files.
 */
public final class TestCompilerState {

    public static final String SCHEMA = """
            type Query {
              viewer: User
              user(id: ID!): User
              node(id: ID!): Node
              search(term: String!, limit: Int = 10): [SearchResult!]!
            }

            type Mutation {
              renameUser(id: ID!, name: String!): User
            }

            interface Node { id: ID! }

            type User implements Node {
              id: ID!
              name: String
              role: Role
              avatar(size: Int): String
              friends(first: Int = 10, filter: FriendFilter): [User!]!
            }

            type Post implements Node {
              id: ID!
              title: String
              author: User
            }

            type Comment {
              body: String
            }

            union SearchResult = User | Post

            enum Role { ADMIN MEMBER }

            input FriendFilter { role: Role, nameContains: String }

            directive @cached on QUERY
            """;

    private final Map<String, String> texts = new LinkedHashMap<>();
    private final Map<String, ProjectSourceSet.ProjectSourceSetBuilder> projects = new LinkedHashMap<>();

    public static TestCompilerState create() {
        return new TestCompilerState();
    }

    public static ProjectConfig project(String name) {
        return ProjectConfig.builder()
                .name(name)
                .schema(Path.of("schema.graphql"))
                .source(Path.of("src", name))
                .output(Path.of("out", name))
                .build();
    }

    public static ProjectConfig project(String name, String base) {
        return project(name).toBuilder().base(base).build();
    }

    /**
     * Single project "app" with the shared schema and one document.
     */
    public static CompilerState single(String documentKey, String document) {
        return create()
                .schema("app", "schema.graphql", SCHEMA)
                .document("app", documentKey, document)
                .build();
    }

    /**
     * Runs schema and IR stages, failing the test on any error.
     */
    public static BuildIrResult buildIr(CompilerState state, ProjectConfig project) {
        Schema schema = new ExtendingSchemaBuilder().build(state, project);
        return new TypeCheckingIrBuilder().build(project, schema, AstSets.parse(state).getValue()).getValue();
    }

    public static Program program(CompilerState state, ProjectConfig project) {
        Schema schema = new ExtendingSchemaBuilder().build(state, project);
        return Program.fromDefinitions(schema, buildIr(state, project).getDefinitions());
    }

    public TestCompilerState schema(String project, String key, String text) {
        texts.put(key, text);
        sourceSet(project).schemaKey(key);
        return this;
    }

    public TestCompilerState extension(String project, String key, String text) {
        texts.put(key, text);
        sourceSet(project).extensionKey(key);
        return this;
    }

    public TestCompilerState document(String project, String key, String text) {
        texts.put(key, text);
        sourceSet(project).documentKey(key);
        return this;
    }

    public CompilerState build() {
        CompilerState.CompilerStateBuilder state = CompilerState.builder().sources(Sources.of(texts));
        projects.forEach((name, sourceSet) -> state.project(name, sourceSet.build()));
        return state.build();
    }

    private ProjectSourceSet.ProjectSourceSetBuilder sourceSet(String project) {
        return projects.computeIfAbsent(project, name -> ProjectSourceSet.builder().projectName(name));
    }
}

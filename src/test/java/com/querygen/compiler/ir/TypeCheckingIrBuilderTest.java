package com.querygen.compiler.ir;

import java.util.List;

import com.querygen.compiler.TestCompilerState;
import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.ResolvedError;
import com.querygen.compiler.error.StageResult;
import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.model.ExecutableDocument;
import com.querygen.compiler.model.OperationDefinitionNode;
import com.querygen.compiler.model.OperationKind;
import com.querygen.compiler.model.ValueNode;
import com.querygen.compiler.model.VariableDefinitionNode;
import com.querygen.compiler.schema.ExtendingSchemaBuilder;
import com.querygen.compiler.schema.Schema;
import com.querygen.compiler.state.AstSets;
import com.querygen.compiler.state.CompilerState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TypeCheckingIrBuilder.
 */
class TypeCheckingIrBuilderTest {

    private final TypeCheckingIrBuilder irBuilder = new TypeCheckingIrBuilder();

    @Test
    void testBuildsTypedSelections() {
        CompilerState state = state("""
                query UserQuery($id: ID!) {
                  user(id: $id) {
                    id
                    displayName: name
                    ...UserFragment
                  }
                }

                fragment UserFragment on User {
                  friends(first: 5) { id }
                }
                """);

        BuildIrResult ir = build(state, TestCompilerState.project("app")).getValue();

        assertThat(ir.getDefinitions()).extracting(ExecutableDefinition::getName)
                .containsExactly("UserQuery", "UserFragment");
        assertThat(ir.getBaseFragmentNames()).isEmpty();

        Operation operation = (Operation) ir.getDefinitions().get(0);
        assertThat(operation.getKind()).isEqualTo(OperationKind.QUERY);
        assertThat(operation.getRootType()).isEqualTo("Query");
        assertThat(operation.getVariableDefinitions()).extracting(VariableDefinition::getName).containsExactly("id");

        LinkedField user = (LinkedField) operation.getSelections().get(0);
        assertThat(user.getType().getNamedType()).isEqualTo("User");
        assertThat(user.getArguments()).hasSize(1);
        assertThat(user.getSelections()).hasSize(3);
        assertThat(user.getSelections().get(0)).isInstanceOf(ScalarField.class);
        assertThat(((ScalarField) user.getSelections().get(1)).getResponseKey()).isEqualTo("displayName");
        assertThat(user.getSelections().get(2)).isInstanceOf(FragmentSpread.class);
    }

    @Test
    void testUnknownFieldIsReportedAtTheFieldName() {
        String document = """
                query UserQuery {
                  viewer {
                    email
                  }
                }
                """;
        CompilerState state = state(document);

        StageResult<BuildIrResult> result = build(state, TestCompilerState.project("app"));

        assertThat(result.isOk()).isFalse();
        assertThat(result.getErrors()).hasSize(1);
        ValidationError error = result.getErrors().get(0);
        assertThat(error.getMessage()).isEqualTo("Unknown field 'email' on type 'User'");

        int start = document.indexOf("email");
        assertThat(error.getLocations().get(0).getSourceKey()).isEqualTo("src/User.graphql");
        assertThat(error.getLocations().get(0).getSpan().getStart()).isEqualTo(start);
        assertThat(error.getLocations().get(0).getSpan().getEnd()).isEqualTo(start + "email".length());

        ResolvedError resolved = error.withSources(state.getSources());
        assertThat(resolved.getLocations().get(0).getText()).isEqualTo("email");
        assertThat(resolved.getLocations().get(0).getLine()).isEqualTo(3);
    }

    @Test
    void testCollectsEveryErrorOfTheProject() {
        CompilerState state = state("""
                query UserQuery {
                  viewer { email }
                  user { id }
                  node(id: $missing) { id ...Nope }
                  search(term: 42) { __typename }
                  viewer { name { first } }
                  viewer
                }
                """);

        List<ValidationError> errors = build(state, TestCompilerState.project("app")).getErrors();

        assertThat(errors).extracting(ValidationError::getMessage).containsExactlyInAnyOrder(
                "Unknown field 'email' on type 'User'",
                "Missing required argument 'id' on field 'Query.user'",
                "Variable '$missing' is not defined by operation 'UserQuery'",
                "Unknown fragment 'Nope'",
                "Expected value of type 'String!', found 42",
                "Field 'name' must not have a selection since type 'String' has no subfields",
                "Field 'viewer' of type 'User' must have a selection of subfields");
    }

    @Test
    void testReferencedBaseFragmentsArePulledInTransitively() {
        CompilerState state = TestCompilerState.create()
                .schema("common", "schema.graphql", TestCompilerState.SCHEMA)
                .schema("app", "schema.graphql", TestCompilerState.SCHEMA)
                .document("common", "common/Common.graphql", """
                        fragment CommonUserFragment on User { id ...CommonNameFragment }
                        fragment CommonNameFragment on User { name }
                        fragment CommonUnusedFragment on User { role }
                        query CommonViewerQuery { viewer { id } }
                        """)
                .document("app", "src/User.graphql", """
                        query UserQuery { viewer { ...CommonUserFragment } }
                        """)
                .build();

        BuildIrResult ir = build(state, TestCompilerState.project("app", "common")).getValue();

        assertThat(ir.getDefinitions()).extracting(ExecutableDefinition::getName)
                .containsExactly("UserQuery", "CommonUserFragment", "CommonNameFragment");
        assertThat(ir.getBaseFragmentNames()).containsExactly("CommonUserFragment", "CommonNameFragment");
    }

    @Test
    void testBaseFragmentsAreInvisibleWithoutBaseProject() {
        CompilerState state = TestCompilerState.create()
                .schema("common", "schema.graphql", TestCompilerState.SCHEMA)
                .schema("app", "schema.graphql", TestCompilerState.SCHEMA)
                .document("common", "common/Common.graphql", "fragment CommonUserFragment on User { id }")
                .document("app", "src/User.graphql", "query UserQuery { viewer { ...CommonUserFragment } }")
                .build();

        assertThat(build(state, TestCompilerState.project("app")).getErrors())
                .extracting(ValidationError::getMessage)
                .containsExactly("Unknown fragment 'CommonUserFragment'");
    }

    @Test
    void testBaseFragmentNamedLikeProjectOperationIsReported() {
        CompilerState state = TestCompilerState.create()
                .schema("common", "schema.graphql", TestCompilerState.SCHEMA)
                .schema("app", "schema.graphql", TestCompilerState.SCHEMA)
                .document("common", "common/Common.graphql", "fragment UserQuery on User { name }")
                .document("app", "src/User.graphql", "query UserQuery { viewer { ...UserQuery } }")
                .build();

        StageResult<BuildIrResult> result = build(state, TestCompilerState.project("app", "common"));

        assertThat(result.isOk()).isFalse();
        assertThat(result.getErrors()).extracting(ValidationError::getMessage)
                .contains("'UserQuery' is also defined as a fragment in the base project");
        assertThat(result.getErrors())
                .filteredOn(e -> e.getMessage().contains("base project"))
                .singleElement()
                .satisfies(e -> assertThat(e.getLocations()).extracting(l -> l.getSourceKey())
                        .containsExactly("src/User.graphql", "common/Common.graphql"));
    }

    @Test
    void testReportsDuplicateAndAnonymousDefinitions() {
        CompilerState state = state("""
                query UserQuery { viewer { id } }
                query UserQuery { viewer { name } }
                { viewer { id } }
                """);

        List<ValidationError> errors = build(state, TestCompilerState.project("app")).getErrors();

        assertThat(errors).extracting(ValidationError::getMessage)
                .containsExactlyInAnyOrder("Duplicate definitions for 'UserQuery'", "Operations must be named");
        assertThat(errors).filteredOn(e -> e.getMessage().startsWith("Duplicate"))
                .singleElement()
                .satisfies(e -> assertThat(e.getLocations()).hasSize(2));
    }

    @Test
    void testReportsFragmentCycles() {
        CompilerState state = state("""
                fragment UserAFragment on User { ...UserBFragment }
                fragment UserBFragment on User { ...UserAFragment }
                """);

        assertThat(build(state, TestCompilerState.project("app")).getErrors())
                .extracting(ValidationError::getMessage)
                .containsExactlyInAnyOrder("Fragment 'UserAFragment' spreads itself",
                        "Fragment 'UserBFragment' spreads itself");
    }

    @Test
    void testRejectsFragmentsThatCanNeverMatch() {
        CompilerState state = state("""
                query UserQuery { viewer { ... on Post { title } ...UserCommentFragment } }
                fragment UserCommentFragment on Comment { body }
                """);

        assertThat(build(state, TestCompilerState.project("app")).getErrors())
                .extracting(ValidationError::getMessage)
                .containsExactlyInAnyOrder(
                        "Inline fragment on 'Post' can never match 'User'",
                        "Fragment 'UserCommentFragment' cannot be spread here: type 'Comment' can never match 'User'");
    }

    @Test
    void testUnknownDirectiveAndEnumValue() {
        CompilerState state = state("""
                query UserQuery { viewer @shiny { friends(filter: {role: OWNER}) { id } } }
                """);

        assertThat(build(state, TestCompilerState.project("app")).getErrors())
                .extracting(ValidationError::getMessage)
                .containsExactlyInAnyOrder("Unknown directive '@shiny'", "Expected value of type 'Role', found OWNER");
    }

    @Test
    void testVariableDefaultValueMustBeConstant() {
        CompilerState state = state("""
                query UserQuery($first: Int = 5, $limit: Int) { viewer { friends(first: $first) { id } } }
                """);
        AstSets parsed = AstSets.parse(state).getValue();
        OperationDefinitionNode operation = (OperationDefinitionNode) parsed.get("app").get(0).getDefinitions().get(0);
        VariableDefinitionNode first = operation.getVariableDefinitions().get(0);
        OperationDefinitionNode withVariableDefault = operation.toBuilder()
                .clearVariableDefinitions()
                .variableDefinition(first.toBuilder()
                        .defaultValue(ValueNode.builder().kind(ValueNode.Kind.VARIABLE).raw("limit").build())
                        .build())
                .variableDefinition(operation.getVariableDefinitions().get(1))
                .build();
        AstSets astSets = AstSets.builder()
                .project("app", List.of(ExecutableDocument.builder()
                        .sourceKey("src/User.graphql")
                        .definition(withVariableDefault)
                        .build()))
                .build();
        ProjectConfig project = TestCompilerState.project("app");

        StageResult<BuildIrResult> result = irBuilder.build(project,
                new ExtendingSchemaBuilder().build(state, project), astSets);

        assertThat(result.getErrors()).extracting(ValidationError::getMessage)
                .containsExactly("Default value of variable '$first' must be a constant");
        assertThat(result.getErrors().get(0).getLocations()).containsExactly(first.getLocation());
    }

    private static CompilerState state(String document) {
        return TestCompilerState.create()
                .schema("app", "schema.graphql", TestCompilerState.SCHEMA)
                .document("app", "src/User.graphql", document)
                .build();
    }

    private StageResult<BuildIrResult> build(CompilerState state, ProjectConfig project) {
        Schema schema = new ExtendingSchemaBuilder().build(state, project);
        AstSets astSets = AstSets.parse(state).getValue();
        return irBuilder.build(project, schema, astSets);
    }
}

package com.querygen.compiler.parser;

import com.querygen.compiler.model.OperationKind;
import com.querygen.compiler.model.SchemaDocument;
import com.querygen.compiler.model.TypeDefinitionNode;
import com.querygen.compiler.model.TypeKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SchemaParserTest {

    @Test
    void testParseTypesAndRootOperations() {
        String sdl = """
                schema { query: Root }

                "The root"
                type Root {
                  node(id: ID!): Node
                  users(first: Int = 10): [User!]!
                }

                interface Node { id: ID! }

                type User implements Node & Named {
                  id: ID!
                  name: String
                }

                interface Named { name: String }

                enum Role { ADMIN USER }

                union SearchResult = User | Root

                input UserFilter { role: Role, limit: Int = 5 }

                scalar DateTime

                directive @cached(ttl: Int) on FIELD | QUERY
                """;

        SchemaDocument document = new SchemaParser(sdl, "schema.graphql").parse();

        assertThat(document.getRootTypes()).containsEntry(OperationKind.QUERY, "Root");
        assertThat(document.getTypes()).extracting(TypeDefinitionNode::getName)
                .containsExactly("Root", "Node", "User", "Named", "Role", "SearchResult", "UserFilter", "DateTime");

        TypeDefinitionNode user = document.getTypes().get(2);
        assertThat(user.getKind()).isEqualTo(TypeKind.OBJECT);
        assertThat(user.getInterfaces()).containsExactly("Node", "Named");
        assertThat(user.getFields()).hasSize(2);

        assertThat(document.getTypes().get(4).getEnumValues()).containsExactly("ADMIN", "USER");
        assertThat(document.getTypes().get(5).getMembers()).containsExactly("User", "Root");
        assertThat(document.getTypes().get(6).getInputFields()).hasSize(2);
        assertThat(document.getDirectives()).hasSize(1);
    }

    @Test
    void testParseExtendType() {
        SchemaDocument document = new SchemaParser("extend type User { nickname: String }", "ext.graphql").parse();

        TypeDefinitionNode extension = document.getTypes().get(0);
        assertThat(extension.isExtension()).isTrue();
        assertThat(extension.getName()).isEqualTo("User");
        assertThat(extension.getFields()).hasSize(1);
    }

    @Test
    void testUnknownKeywordFails() {
        assertThatThrownBy(() -> new SchemaParser("banana Foo { a: Int }", "s.graphql").parse())
                .isInstanceOf(ParseException.class);
    }
}

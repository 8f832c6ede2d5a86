package com.querygen.compiler.parser;

import com.querygen.compiler.model.ExecutableDocument;
import com.querygen.compiler.model.FieldSelectionNode;
import com.querygen.compiler.model.FragmentDefinitionNode;
import com.querygen.compiler.model.FragmentSpreadNode;
import com.querygen.compiler.model.InlineFragmentNode;
import com.querygen.compiler.model.OperationDefinitionNode;
import com.querygen.compiler.model.OperationKind;
import com.querygen.compiler.model.ValueNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GraphQLTokenizer and DocumentParser.
 */
class DocumentParserTest {

    @Test
    void testParseNamedQueryWithSpanOnFieldName() {
        String source = """
                query UserQuery {
                  user { id name }
                }
                """;

        ExecutableDocument document = new DocumentParser(source, "src/User.graphql").parse();

        assertThat(document.getDefinitions()).hasSize(1);
        OperationDefinitionNode operation = (OperationDefinitionNode) document.getDefinitions().get(0);
        assertThat(operation.getKind()).isEqualTo(OperationKind.QUERY);
        assertThat(operation.getName()).isEqualTo("UserQuery");

        FieldSelectionNode user = (FieldSelectionNode) operation.getSelections().get(0);
        assertThat(user.getName()).isEqualTo("user");
        assertThat(user.isHasSelectionSet()).isTrue();
        assertThat(user.getSelections()).hasSize(2);

        int start = user.getLocation().getSpan().getStart();
        assertThat(source.substring(start, user.getLocation().getSpan().getEnd())).isEqualTo("user");
        assertThat(user.getLocation().getSourceKey()).isEqualTo("src/User.graphql");
    }

    @Test
    void testParseFragmentsSpreadsAndInlineFragments() {
        String source = """
                fragment UserFragment on User {
                  id
                  ...Other @include(if: $withOther)
                  ... on Admin { level }
                }
                """;

        ExecutableDocument document = new DocumentParser(source, "f.graphql").parse();
        FragmentDefinitionNode fragment = (FragmentDefinitionNode) document.getDefinitions().get(0);

        assertThat(fragment.getName()).isEqualTo("UserFragment");
        assertThat(fragment.getTypeCondition()).isEqualTo("User");
        assertThat(fragment.getSelections()).hasSize(3);

        FragmentSpreadNode spread = (FragmentSpreadNode) fragment.getSelections().get(1);
        assertThat(spread.getName()).isEqualTo("Other");
        assertThat(spread.getDirectives()).hasSize(1);
        assertThat(spread.getDirectives().get(0).getName()).isEqualTo("include");

        InlineFragmentNode inline = (InlineFragmentNode) fragment.getSelections().get(2);
        assertThat(inline.getTypeCondition()).isEqualTo("Admin");
    }

    @Test
    void testParseAliasesArgumentsAndVariables() {
        String source = """
                query FeedQuery($first: Int = 10, $after: String) {
                  items: feed(first: $first, after: $after, order: NEWEST, tags: ["a", "b"]) { id }
                }
                """;

        OperationDefinitionNode operation =
                (OperationDefinitionNode) new DocumentParser(source, "feed.graphql").parse().getDefinitions().get(0);

        assertThat(operation.getVariableDefinitions()).hasSize(2);
        assertThat(operation.getVariableDefinitions().get(0).getDefaultValue().getRaw()).isEqualTo("10");

        FieldSelectionNode feed = (FieldSelectionNode) operation.getSelections().get(0);
        assertThat(feed.getAlias()).isEqualTo("items");
        assertThat(feed.getResponseKey()).isEqualTo("items");
        assertThat(feed.getArguments()).extracting(a -> a.getName()).containsExactly("first", "after", "order", "tags");
        assertThat(feed.getArguments().get(0).getValue().getKind()).isEqualTo(ValueNode.Kind.VARIABLE);
        assertThat(feed.getArguments().get(2).getValue().getKind()).isEqualTo(ValueNode.Kind.ENUM);
        assertThat(feed.getArguments().get(3).getValue().print()).isEqualTo("[\"a\", \"b\"]");
    }

    @Test
    void testIgnoresCommentsAndCommas() {
        String source = """
                # leading comment
                query Q { a, b # trailing
                  c }
                """;

        OperationDefinitionNode operation =
                (OperationDefinitionNode) new DocumentParser(source, "q.graphql").parse().getDefinitions().get(0);

        assertThat(operation.getSelections()).hasSize(3);
    }

    @Test
    void testAnonymousOperationHasNoName() {
        OperationDefinitionNode operation =
                (OperationDefinitionNode) new DocumentParser("{ viewer { id } }", "a.graphql").parse()
                        .getDefinitions().get(0);

        assertThat(operation.getName()).isNull();
        assertThat(operation.getKind()).isEqualTo(OperationKind.QUERY);
    }

    @Test
    void testUnterminatedSelectionSetFails() {
        assertThatThrownBy(() -> new DocumentParser("query Q { user { id }", "bad.graphql").parse())
                .isInstanceOf(ParseException.class);
    }

    @Test
    void testUnterminatedStringReportsLocation() {
        ParseException e = catchThrowableOfType(
                () -> new DocumentParser("query Q { user(name: \"abc) { id } }", "bad.graphql").parse(),
                ParseException.class);

        assertThat(e.getMessage()).contains("Unterminated string");
        assertThat(e.getLocation().getSourceKey()).isEqualTo("bad.graphql");
        assertThat(e.toValidationError().getMessage()).startsWith("Syntax error: ");
    }

    @Test
    void testStringEscapesAreDecoded() {
        ExecutableDocument document = new DocumentParser(
                "query Q { user(id: \"\\u00e9\\b\\f\\/\\r\") { id } }", "src/Q.graphql").parse();

        OperationDefinitionNode operation = (OperationDefinitionNode) document.getDefinitions().get(0);
        FieldSelectionNode user = (FieldSelectionNode) operation.getSelections().get(0);
        assertThat(user.getArguments().get(0).getValue().getRaw()).isEqualTo("\u00e9\b\f/\r");
    }

    @Test
    void testInvalidEscapesAreSyntaxErrors() {
        assertThatThrownBy(() -> new DocumentParser("query Q { user(id: \"a\\qb\") { id } }", "src/Q.graphql").parse())
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Invalid escape sequence");
        assertThatThrownBy(() -> new DocumentParser("query Q { user(id: \"\\u00zz\") { id } }", "src/Q.graphql").parse())
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Invalid unicode escape");
    }

    @Test
    void testBlockStringIsDedented() {
        String source = "query Q {\n"
                + "  search(term: \"\"\"\n"
                + "\n"
                + "      first\n"
                + "        second \\\"\"\" quoted\n"
                + "\n"
                + "      \"\"\") { id }\n"
                + "}\n";

        ExecutableDocument document = new DocumentParser(source, "src/Q.graphql").parse();

        OperationDefinitionNode operation = (OperationDefinitionNode) document.getDefinitions().get(0);
        FieldSelectionNode search = (FieldSelectionNode) operation.getSelections().get(0);
        assertThat(search.getArguments().get(0).getValue().getRaw()).isEqualTo("first\n  second \"\"\" quoted");
        assertThat(search.getSelections()).hasSize(1);
    }

    @Test
    void testVariablesAreRejectedInDefaultValues() {
        assertThatThrownBy(() -> new DocumentParser(
                "query Q($a: Int, $b: [Int] = [1, $a]) { user(id: 1) { id } }", "src/Q.graphql").parse())
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Unexpected variable in constant value");
    }
}

package com.querygen.compiler.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.model.ExecutableDocument;
import com.querygen.compiler.model.FieldSelectionNode;
import com.querygen.compiler.model.FragmentDefinitionNode;
import com.querygen.compiler.model.FragmentSpreadNode;
import com.querygen.compiler.model.InlineFragmentNode;
import com.querygen.compiler.model.OperationDefinitionNode;
import com.querygen.compiler.model.OperationKind;
import com.querygen.compiler.model.SelectionNode;
import com.querygen.compiler.model.VariableDefinitionNode;
import com.querygen.compiler.parser.GraphQLToken.TokenType;
import com.querygen.compiler.source.Location;

/**
 * Parser for executable GraphQL documents (operations and fragments).
 *
 * Parsing only: no schema lookups, no type checking.
 */
public class DocumentParser extends AbstractGraphQLParser {
    private static final Logger log = LoggerFactory.getLogger(DocumentParser.class);

    public DocumentParser(String source, String sourceKey) {
        super(source, sourceKey);
    }

    /**
     * Parse the whole document.
     *
     * @throws ParseException on the first syntax error
     */
    public ExecutableDocument parse() {
        ExecutableDocument.ExecutableDocumentBuilder document = ExecutableDocument.builder().sourceKey(sourceKey);

        while (!isAtEnd()) {
            if (check(TokenType.LBRACE)) {
                GraphQLToken brace = peek();
                document.definition(OperationDefinitionNode.builder()
                        .kind(OperationKind.QUERY)
                        .location(location(brace))
                        .selections(parseSelectionSet())
                        .build());
            } else if (checkName("fragment")) {
                document.definition(parseFragment());
            } else if (check(TokenType.NAME) && OperationKind.fromKeyword(peek().getValue()) != null) {
                document.definition(parseOperation());
            } else {
                throw error("Expected an operation or fragment definition but found '" + peek().getValue() + "'", peek());
            }
        }

        ExecutableDocument parsed = document.build();
        log.debug("Parsed {} definition(s) from {}", parsed.getDefinitions().size(), sourceKey);
        return parsed;
    }

    private OperationDefinitionNode parseOperation() {
        GraphQLToken keyword = advance();
        OperationDefinitionNode.OperationDefinitionNodeBuilder operation = OperationDefinitionNode.builder()
                .kind(OperationKind.fromKeyword(keyword.getValue()));

        if (check(TokenType.NAME)) {
            GraphQLToken name = advance();
            operation.name(name.getValue()).location(location(name));
        } else {
            operation.location(location(keyword));
        }

        operation.variableDefinitions(parseVariableDefinitions());
        operation.directives(parseDirectives(false));
        operation.selections(parseSelectionSet());
        return operation.build();
    }

    private List<VariableDefinitionNode> parseVariableDefinitions() {
        List<VariableDefinitionNode> variables = new ArrayList<>();
        if (!check(TokenType.LPAREN)) {
            return variables;
        }
        advance();
        while (!check(TokenType.RPAREN) && !isAtEnd()) {
            GraphQLToken dollar = expect(TokenType.DOLLAR);
            GraphQLToken name = expectName();
            expect(TokenType.COLON);
            GraphQLToken typeStart = peek();
            VariableDefinitionNode.VariableDefinitionNodeBuilder variable = VariableDefinitionNode.builder()
                    .name(name.getValue())
                    .location(Location.of(sourceKey, dollar.getStart(), name.getEnd()))
                    .type(parseTypeRef());
            variable.typeLocation(Location.of(sourceKey, typeStart.getStart(), previous().getEnd()));
            if (check(TokenType.EQUALS)) {
                advance();
                variable.defaultValue(parseValue(true));
            }
            variables.add(variable.build());
        }
        expect(TokenType.RPAREN);
        return variables;
    }

    private FragmentDefinitionNode parseFragment() {
        expectKeyword("fragment");
        GraphQLToken name = expectName();
        if (name.getValue().equals("on")) {
            throw error("Fragment name expected before 'on'", name);
        }
        expectKeyword("on");
        GraphQLToken typeCondition = expectName();

        return FragmentDefinitionNode.builder()
                .name(name.getValue())
                .location(location(name))
                .typeCondition(typeCondition.getValue())
                .typeConditionLocation(location(typeCondition))
                .directives(parseDirectives(false))
                .selections(parseSelectionSet())
                .build();
    }

    private List<SelectionNode> parseSelectionSet() {
        expect(TokenType.LBRACE);
        List<SelectionNode> selections = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (isAtEnd()) {
                throw error("Unterminated selection set", peek());
            }
            selections.add(parseSelection());
        }
        expect(TokenType.RBRACE);
        if (selections.isEmpty()) {
            throw error("Selection set must not be empty", previous());
        }
        return selections;
    }

    private SelectionNode parseSelection() {
        if (check(TokenType.SPREAD)) {
            GraphQLToken spread = advance();
            if (check(TokenType.NAME) && !checkName("on")) {
                GraphQLToken name = advance();
                return FragmentSpreadNode.builder()
                        .name(name.getValue())
                        .location(location(name))
                        .directives(parseDirectives(false))
                        .build();
            }
            InlineFragmentNode.InlineFragmentNodeBuilder inline = InlineFragmentNode.builder();
            if (checkName("on")) {
                advance();
                GraphQLToken typeCondition = expectName();
                inline.typeCondition(typeCondition.getValue()).location(location(typeCondition));
            } else {
                inline.location(location(spread));
            }
            return inline.directives(parseDirectives(false))
                    .selections(parseSelectionSet())
                    .build();
        }

        GraphQLToken first = expectName();
        FieldSelectionNode.FieldSelectionNodeBuilder field = FieldSelectionNode.builder();
        if (check(TokenType.COLON)) {
            advance();
            GraphQLToken name = expectName();
            field.alias(first.getValue()).aliasLocation(location(first))
                    .name(name.getValue()).location(location(name));
        } else {
            field.name(first.getValue()).location(location(first));
        }

        field.arguments(parseArguments(false));
        field.directives(parseDirectives(false));
        if (check(TokenType.LBRACE)) {
            field.hasSelectionSet(true);
            field.selections(parseSelectionSet());
        }
        return field.build();
    }
}

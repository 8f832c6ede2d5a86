package com.querygen.compiler.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.model.DirectiveDefinitionNode;
import com.querygen.compiler.model.FieldDefinitionNode;
import com.querygen.compiler.model.InputValueDefinitionNode;
import com.querygen.compiler.model.OperationKind;
import com.querygen.compiler.model.SchemaDocument;
import com.querygen.compiler.model.TypeDefinitionNode;
import com.querygen.compiler.model.TypeKind;
import com.querygen.compiler.parser.GraphQLToken.TokenType;

/**
 * Parser for schema definition language: type, interface, union, enum, input, scalar and directive
 * declarations, {@code extend} blocks and the {@code schema} root declaration.
 */
public class SchemaParser extends AbstractGraphQLParser {
    private static final Logger log = LoggerFactory.getLogger(SchemaParser.class);

    public SchemaParser(String source, String sourceKey) {
        super(source, sourceKey);
    }

    /**
     * @throws ParseException on the first syntax error
     */
    public SchemaDocument parse() {
        SchemaDocument.SchemaDocumentBuilder document = SchemaDocument.builder().sourceKey(sourceKey);

        while (!isAtEnd()) {
            if (check(TokenType.STRING)) {
                advance(); // description
                continue;
            }
            boolean extension = false;
            if (checkName("extend")) {
                advance();
                extension = true;
            }

            GraphQLToken keyword = expectName();
            switch (keyword.getValue()) {
                case "schema" -> parseSchemaDefinition(document);
                case "directive" -> document.directive(parseDirectiveDefinition());
                case "type" -> document.type(parseObjectLike(TypeKind.OBJECT, extension));
                case "interface" -> document.type(parseObjectLike(TypeKind.INTERFACE, extension));
                case "input" -> document.type(parseInputObject(extension));
                case "enum" -> document.type(parseEnum(extension));
                case "union" -> document.type(parseUnion(extension));
                case "scalar" -> {
                    GraphQLToken name = expectName();
                    parseDirectives(true);
                    document.type(TypeDefinitionNode.builder()
                            .kind(TypeKind.SCALAR).name(name.getValue()).location(location(name))
                            .extension(extension).build());
                }
                default -> throw error("Unexpected '" + keyword.getValue() + "' in schema", keyword);
            }
        }

        SchemaDocument parsed = document.build();
        log.debug("Parsed {} type(s) from {}", parsed.getTypes().size(), sourceKey);
        return parsed;
    }

    private void parseSchemaDefinition(SchemaDocument.SchemaDocumentBuilder document) {
        parseDirectives(true);
        expect(TokenType.LBRACE);
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            GraphQLToken operation = expectName();
            OperationKind kind = OperationKind.fromKeyword(operation.getValue());
            if (kind == null) {
                throw error("Unknown root operation '" + operation.getValue() + "'", operation);
            }
            expect(TokenType.COLON);
            document.rootType(kind, expectName().getValue());
        }
        expect(TokenType.RBRACE);
    }

    private DirectiveDefinitionNode parseDirectiveDefinition() {
        expect(TokenType.AT);
        GraphQLToken name = expectName();
        DirectiveDefinitionNode.DirectiveDefinitionNodeBuilder directive = DirectiveDefinitionNode.builder()
                .name(name.getValue())
                .location(location(name));
        if (check(TokenType.LPAREN)) {
            advance();
            while (!check(TokenType.RPAREN) && !isAtEnd()) {
                directive.argument(parseInputValue());
            }
            expect(TokenType.RPAREN);
        }
        if (checkName("repeatable")) {
            advance();
        }
        expectKeyword("on");
        if (check(TokenType.PIPE)) {
            advance();
        }
        directive.directiveLocation(expectName().getValue());
        while (check(TokenType.PIPE)) {
            advance();
            directive.directiveLocation(expectName().getValue());
        }
        return directive.build();
    }

    private TypeDefinitionNode parseObjectLike(TypeKind kind, boolean extension) {
        GraphQLToken name = expectName();
        TypeDefinitionNode.TypeDefinitionNodeBuilder type = TypeDefinitionNode.builder()
                .kind(kind).name(name.getValue()).location(location(name)).extension(extension);

        if (checkName("implements")) {
            advance();
            if (check(TokenType.AMP)) {
                advance();
            }
            type.implementedInterface(expectName().getValue());
            while (check(TokenType.AMP)) {
                advance();
                type.implementedInterface(expectName().getValue());
            }
        }
        parseDirectives(true);

        if (check(TokenType.LBRACE)) {
            advance();
            while (!check(TokenType.RBRACE) && !isAtEnd()) {
                type.field(parseFieldDefinition());
            }
            expect(TokenType.RBRACE);
        }
        return type.build();
    }

    private FieldDefinitionNode parseFieldDefinition() {
        if (check(TokenType.STRING)) {
            advance();
        }
        GraphQLToken name = expectName();
        FieldDefinitionNode.FieldDefinitionNodeBuilder field = FieldDefinitionNode.builder()
                .name(name.getValue())
                .location(location(name));
        if (check(TokenType.LPAREN)) {
            advance();
            while (!check(TokenType.RPAREN) && !isAtEnd()) {
                field.argument(parseInputValue());
            }
            expect(TokenType.RPAREN);
        }
        expect(TokenType.COLON);
        field.type(parseTypeRef());
        parseDirectives(true);
        return field.build();
    }

    private InputValueDefinitionNode parseInputValue() {
        if (check(TokenType.STRING)) {
            advance();
        }
        GraphQLToken name = expectName();
        expect(TokenType.COLON);
        InputValueDefinitionNode.InputValueDefinitionNodeBuilder input = InputValueDefinitionNode.builder()
                .name(name.getValue())
                .location(location(name))
                .type(parseTypeRef());
        if (check(TokenType.EQUALS)) {
            advance();
            input.defaultValue(parseValue(true));
        }
        parseDirectives(true);
        return input.build();
    }

    private TypeDefinitionNode parseInputObject(boolean extension) {
        GraphQLToken name = expectName();
        TypeDefinitionNode.TypeDefinitionNodeBuilder type = TypeDefinitionNode.builder()
                .kind(TypeKind.INPUT_OBJECT).name(name.getValue()).location(location(name)).extension(extension);
        parseDirectives(true);
        expect(TokenType.LBRACE);
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            type.inputField(parseInputValue());
        }
        expect(TokenType.RBRACE);
        return type.build();
    }

    private TypeDefinitionNode parseEnum(boolean extension) {
        GraphQLToken name = expectName();
        TypeDefinitionNode.TypeDefinitionNodeBuilder type = TypeDefinitionNode.builder()
                .kind(TypeKind.ENUM).name(name.getValue()).location(location(name)).extension(extension);
        parseDirectives(true);
        expect(TokenType.LBRACE);
        while (!check(TokenType.RBRACE) && !isAtEnd()) {
            if (check(TokenType.STRING)) {
                advance();
            }
            type.enumValue(expectName().getValue());
            parseDirectives(true);
        }
        expect(TokenType.RBRACE);
        return type.build();
    }

    private TypeDefinitionNode parseUnion(boolean extension) {
        GraphQLToken name = expectName();
        TypeDefinitionNode.TypeDefinitionNodeBuilder type = TypeDefinitionNode.builder()
                .kind(TypeKind.UNION).name(name.getValue()).location(location(name)).extension(extension);
        parseDirectives(true);
        expect(TokenType.EQUALS);
        if (check(TokenType.PIPE)) {
            advance();
        }
        type.member(expectName().getValue());
        while (check(TokenType.PIPE)) {
            advance();
            type.member(expectName().getValue());
        }
        return type.build();
    }
}

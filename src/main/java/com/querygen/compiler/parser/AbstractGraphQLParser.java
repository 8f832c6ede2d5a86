package com.querygen.compiler.parser;

import java.util.ArrayList;
import java.util.List;

import com.querygen.compiler.model.ArgumentNode;
import com.querygen.compiler.model.DirectiveNode;
import com.querygen.compiler.model.TypeRef;
import com.querygen.compiler.model.ValueNode;
import com.querygen.compiler.parser.GraphQLToken.TokenType;
import com.querygen.compiler.source.Location;

/**
 * Token cursor and the grammar pieces shared by schema and executable documents
 * (values, type references, arguments, directives).
 */
abstract class AbstractGraphQLParser {

    protected final List<GraphQLToken> tokens;
    protected final String sourceKey;
    private int pos = 0;

    protected AbstractGraphQLParser(String source, String sourceKey) {
        this.tokens = new GraphQLTokenizer(source, sourceKey).tokenize();
        this.sourceKey = sourceKey;
    }

    protected List<ArgumentNode> parseArguments(boolean constant) {
        List<ArgumentNode> arguments = new ArrayList<>();
        if (!check(TokenType.LPAREN)) {
            return arguments;
        }
        advance();
        do {
            GraphQLToken name = expectName();
            expect(TokenType.COLON);
            arguments.add(new ArgumentNode(name.getValue(), location(name), parseValue(constant)));
        } while (!check(TokenType.RPAREN) && !isAtEnd());
        expect(TokenType.RPAREN);
        return arguments;
    }

    protected List<DirectiveNode> parseDirectives(boolean constant) {
        List<DirectiveNode> directives = new ArrayList<>();
        while (check(TokenType.AT)) {
            GraphQLToken at = advance();
            GraphQLToken name = expectName();
            directives.add(DirectiveNode.builder()
                    .name(name.getValue())
                    .location(Location.of(sourceKey, at.getStart(), name.getEnd()))
                    .arguments(parseArguments(constant))
                    .build());
        }
        return directives;
    }

    protected ValueNode parseValue(boolean constant) {
        GraphQLToken token = peek();
        switch (token.getType()) {
            case DOLLAR -> {
                if (constant) {
                    throw error("Unexpected variable in constant value", token);
                }
                advance();
                GraphQLToken name = expectName();
                return scalar(ValueNode.Kind.VARIABLE, name.getValue(), token.getStart(), name.getEnd());
            }
            case INT -> {
                advance();
                return scalar(ValueNode.Kind.INT, token.getValue(), token.getStart(), token.getEnd());
            }
            case FLOAT -> {
                advance();
                return scalar(ValueNode.Kind.FLOAT, token.getValue(), token.getStart(), token.getEnd());
            }
            case STRING -> {
                advance();
                return scalar(ValueNode.Kind.STRING, token.getValue(), token.getStart(), token.getEnd());
            }
            case NAME -> {
                advance();
                ValueNode.Kind kind = switch (token.getValue()) {
                    case "true", "false" -> ValueNode.Kind.BOOLEAN;
                    case "null" -> ValueNode.Kind.NULL;
                    default -> ValueNode.Kind.ENUM;
                };
                return scalar(kind, token.getValue(), token.getStart(), token.getEnd());
            }
            case LBRACKET -> {
                advance();
                ValueNode.ValueNodeBuilder list = ValueNode.builder().kind(ValueNode.Kind.LIST);
                while (!check(TokenType.RBRACKET) && !isAtEnd()) {
                    list.item(parseValue(constant));
                }
                GraphQLToken close = expect(TokenType.RBRACKET);
                return list.location(Location.of(sourceKey, token.getStart(), close.getEnd())).build();
            }
            case LBRACE -> {
                advance();
                ValueNode.ValueNodeBuilder object = ValueNode.builder().kind(ValueNode.Kind.OBJECT);
                while (!check(TokenType.RBRACE) && !isAtEnd()) {
                    GraphQLToken name = expectName();
                    expect(TokenType.COLON);
                    object.field(name.getValue(), parseValue(constant));
                }
                GraphQLToken close = expect(TokenType.RBRACE);
                return object.location(Location.of(sourceKey, token.getStart(), close.getEnd())).build();
            }
            default -> throw error("Expected a value but found '" + token.getValue() + "'", token);
        }
    }

    protected TypeRef parseTypeRef() {
        TypeRef type;
        if (check(TokenType.LBRACKET)) {
            advance();
            TypeRef inner = parseTypeRef();
            expect(TokenType.RBRACKET);
            type = TypeRef.list(inner);
        } else {
            type = TypeRef.named(expectName().getValue());
        }
        if (check(TokenType.BANG)) {
            advance();
            type = TypeRef.nonNull(type);
        }
        return type;
    }

    private ValueNode scalar(ValueNode.Kind kind, String raw, int start, int end) {
        return ValueNode.builder()
                .kind(kind)
                .raw(raw)
                .location(Location.of(sourceKey, start, end))
                .build();
    }

    protected Location location(GraphQLToken token) {
        return Location.of(sourceKey, token.getStart(), token.getEnd());
    }

    protected ParseException error(String message, GraphQLToken token) {
        return new ParseException(message + " at line " + token.getLine() + ", column " + token.getColumn(),
                location(token));
    }

    protected boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    protected GraphQLToken peek() {
        return tokens.get(pos);
    }

    protected GraphQLToken previous() {
        return tokens.get(pos - 1);
    }

    protected boolean check(TokenType type) {
        return peek().getType() == type;
    }

    protected boolean checkName(String name) {
        return peek().isName(name);
    }

    protected GraphQLToken advance() {
        if (!isAtEnd()) pos++;
        return previous();
    }

    protected GraphQLToken expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        GraphQLToken found = peek();
        throw error("Expected " + type + " but found " + describe(found), found);
    }

    protected GraphQLToken expectName() {
        return expect(TokenType.NAME);
    }

    protected GraphQLToken expectKeyword(String keyword) {
        if (checkName(keyword)) {
            return advance();
        }
        GraphQLToken found = peek();
        throw error("Expected '" + keyword + "' but found " + describe(found), found);
    }

    private static String describe(GraphQLToken token) {
        return token.getType() == TokenType.EOF ? "end of file" : "'" + token.getValue() + "'";
    }
}

package com.querygen.compiler.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the GraphQL tokenizer.
 *
 * {@code start}/{@code end} are character offsets into the original source text.
 */
@Data
@AllArgsConstructor
public class GraphQLToken {
    private TokenType type;
    private String value;
    private int start;
    private int end;
    private int line;
    private int column;

    public enum TokenType {
        NAME,
        INT,
        FLOAT,
        STRING,
        BANG,
        DOLLAR,
        AMP,
        LPAREN,
        RPAREN,
        SPREAD,
        COLON,
        EQUALS,
        AT,
        LBRACKET,
        RBRACKET,
        LBRACE,
        RBRACE,
        PIPE,
        EOF,
        UNKNOWN
    }

    public boolean isName(String name) {
        return type == TokenType.NAME && value.equals(name);
    }
}

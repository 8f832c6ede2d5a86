package com.querygen.compiler.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.querygen.compiler.parser.GraphQLToken.TokenType;
import com.querygen.compiler.source.Location;

/**
 * Tokenizer for GraphQL schema and executable documents.
 *
 * Commas and {@code #} comments are insignificant and dropped. Unknown characters are reported
 * through {@link ParseException}.
 */
public class GraphQLTokenizer {

    private static final Map<Character, TokenType> PUNCTUATORS = Map.ofEntries(
        Map.entry('!', TokenType.BANG),
        Map.entry('$', TokenType.DOLLAR),
        Map.entry('&', TokenType.AMP),
        Map.entry('(', TokenType.LPAREN),
        Map.entry(')', TokenType.RPAREN),
        Map.entry(':', TokenType.COLON),
        Map.entry('=', TokenType.EQUALS),
        Map.entry('@', TokenType.AT),
        Map.entry('[', TokenType.LBRACKET),
        Map.entry(']', TokenType.RBRACKET),
        Map.entry('{', TokenType.LBRACE),
        Map.entry('}', TokenType.RBRACE),
        Map.entry('|', TokenType.PIPE)
    );

    private final String source;
    private final String sourceKey;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public GraphQLTokenizer(String source, String sourceKey) {
        this.source = source;
        this.sourceKey = sourceKey;
    }

    /**
     * Tokenize the entire source text.
     */
    public List<GraphQLToken> tokenize() {
        List<GraphQLToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            skipIgnored();

            if (pos >= source.length()) {
                break;
            }

            tokens.add(nextToken());
        }

        tokens.add(new GraphQLToken(TokenType.EOF, "", pos, pos, line, column));
        return tokens;
    }

    private void skipIgnored() {
        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                line++;
                column = 1;
                pos++;
            } else if (Character.isWhitespace(c) || c == ',' || c == '\uFEFF') {
                column++;
                pos++;
            } else if (c == '#') {
                while (pos < source.length() && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private GraphQLToken nextToken() {
        char c = source.charAt(pos);
        int startPos = pos;
        int startLine = line;
        int startCol = column;

        if (c == '.') {
            if (source.startsWith("...", pos)) {
                advance(3);
                return new GraphQLToken(TokenType.SPREAD, "...", startPos, pos, startLine, startCol);
            }
            throw error("Unexpected '.', did you mean '...'?", startPos, startPos + 1);
        }

        TokenType punctuator = PUNCTUATORS.get(c);
        if (punctuator != null) {
            advance(1);
            return new GraphQLToken(punctuator, String.valueOf(c), startPos, pos, startLine, startCol);
        }

        if (c == '"') {
            return readString(startPos, startLine, startCol);
        }

        if (Character.isDigit(c) || c == '-') {
            return readNumber(startPos, startLine, startCol);
        }

        if (isNameStart(c)) {
            while (pos < source.length() && isNameContinue(source.charAt(pos))) {
                advance(1);
            }
            return new GraphQLToken(TokenType.NAME, source.substring(startPos, pos), startPos, pos, startLine, startCol);
        }

        throw error("Unexpected character '" + c + "'", startPos, startPos + 1);
    }

    private GraphQLToken readString(int startPos, int startLine, int startCol) {
        if (source.startsWith("\"\"\"", pos)) {
            return readBlockString(startPos, startLine, startCol);
        }

        StringBuilder sb = new StringBuilder();
        advance(1); // opening quote

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                advance(1);
                return new GraphQLToken(TokenType.STRING, sb.toString(), startPos, pos, startLine, startCol);
            }
            if (c == '\n' || c == '\r') {
                break;
            }
            if (c == '\\') {
                sb.append(readEscape());
                continue;
            }
            sb.append(c);
            advance(1);
        }

        throw error("Unterminated string", startPos, pos);
    }

    private char readEscape() {
        int escapeStart = pos;
        if (pos + 1 >= source.length()) {
            throw error("Unterminated string", escapeStart, source.length());
        }
        char escaped = source.charAt(pos + 1);
        advance(2);
        return switch (escaped) {
            case '"', '\\', '/' -> escaped;
            case 'b' -> '\b';
            case 'f' -> '\f';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 't' -> '\t';
            case 'u' -> readUnicodeEscape(escapeStart);
            default -> throw error("Invalid escape sequence '\\" + escaped + "'", escapeStart, pos);
        };
    }

    private char readUnicodeEscape(int escapeStart) {
        if (pos + 4 > source.length()) {
            throw error("Invalid unicode escape", escapeStart, source.length());
        }
        String hex = source.substring(pos, pos + 4);
        for (char digit : hex.toCharArray()) {
            if (Character.digit(digit, 16) < 0) {
                throw error("Invalid unicode escape '\\u" + hex + "'", escapeStart, pos + 4);
            }
        }
        advance(4);
        return (char) Integer.parseInt(hex, 16);
    }

    private GraphQLToken readBlockString(int startPos, int startLine, int startCol) {
        advance(3);
        StringBuilder raw = new StringBuilder();
        while (pos < source.length()) {
            if (source.startsWith("\"\"\"", pos)) {
                advance(3);
                return new GraphQLToken(TokenType.STRING, blockStringValue(raw.toString()),
                        startPos, pos, startLine, startCol);
            }
            if (source.startsWith("\\\"\"\"", pos)) {
                raw.append("\"\"\"");
                advance(4);
                continue;
            }
            char c = source.charAt(pos);
            raw.append(c);
            if (c == '\n') {
                line++;
                column = 0;
            }
            advance(1);
        }
        throw error("Unterminated block string", startPos, source.length());
    }

    /**
     * Removes the common indentation of all lines but the first, then leading and trailing blank lines.
     */
    static String blockStringValue(String raw) {
        String[] lines = raw.split("\r\n|\n|\r", -1);

        int commonIndent = -1;
        for (int i = 1; i < lines.length; i++) {
            int indent = leadingWhitespace(lines[i]);
            if (indent < lines[i].length() && (commonIndent < 0 || indent < commonIndent)) {
                commonIndent = indent;
            }
        }
        if (commonIndent > 0) {
            for (int i = 1; i < lines.length; i++) {
                lines[i] = lines[i].length() < commonIndent ? "" : lines[i].substring(commonIndent);
            }
        }

        int first = 0;
        int last = lines.length - 1;
        while (first <= last && leadingWhitespace(lines[first]) == lines[first].length()) {
            first++;
        }
        while (last >= first && leadingWhitespace(lines[last]) == lines[last].length()) {
            last--;
        }
        return first > last ? "" : String.join("\n", Arrays.asList(lines).subList(first, last + 1));
    }

    private static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private GraphQLToken readNumber(int startPos, int startLine, int startCol) {
        boolean isFloat = false;

        if (source.charAt(pos) == '-') {
            advance(1);
        }
        if (pos >= source.length() || !Character.isDigit(source.charAt(pos))) {
            throw error("Expected digit after '-'", startPos, pos);
        }
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c)) {
                advance(1);
            } else if (c == '.' || c == 'e' || c == 'E' || ((c == '+' || c == '-') && isFloat)) {
                isFloat = true;
                advance(1);
            } else {
                break;
            }
        }

        String value = source.substring(startPos, pos);
        return new GraphQLToken(isFloat ? TokenType.FLOAT : TokenType.INT, value, startPos, pos, startLine, startCol);
    }

    private void advance(int count) {
        pos += count;
        column += count;
    }

    private ParseException error(String message, int start, int end) {
        return new ParseException(message, Location.of(sourceKey, start, Math.min(end, source.length())));
    }

    private static boolean isNameStart(char c) {
        return c == '_' || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isNameContinue(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }
}

package com.querygen.compiler.model;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Literal or variable value as written in a document.
 */
@Value
@Builder(toBuilder = true)
public class ValueNode {

    public enum Kind {
        VARIABLE,
        INT,
        FLOAT,
        STRING,
        BOOLEAN,
        NULL,
        ENUM,
        LIST,
        OBJECT
    }

    @NonNull
    Kind kind;

    /** Raw scalar text, variable name or enum name; null for lists and objects. */
    String raw;

    @Singular
    List<ValueNode> items;

    @Singular
    Map<String, ValueNode> fields;

    Location location;

    /** GraphQL source notation of this value. */
    public String print() {
        return print(", ", ": ");
    }

    /** Source notation without insignificant whitespace, e.g. {@code {a:1,b:[2,3]}}. */
    public String printCompact() {
        return print(",", ":");
    }

    /** True when no variable occurs anywhere in this value. */
    public boolean isConstant() {
        return switch (kind) {
            case VARIABLE -> false;
            case LIST -> items.stream().allMatch(ValueNode::isConstant);
            case OBJECT -> fields.values().stream().allMatch(ValueNode::isConstant);
            default -> true;
        };
    }

    private String print(String separator, String colon) {
        return switch (kind) {
            case VARIABLE -> "$" + raw;
            case STRING -> quote(raw);
            case LIST -> items.stream().map(item -> item.print(separator, colon))
                    .collect(Collectors.joining(separator, "[", "]"));
            case OBJECT -> fields.entrySet().stream()
                    .map(e -> e.getKey() + colon + e.getValue().print(separator, colon))
                    .collect(Collectors.joining(separator, "{", "}"));
            case NULL -> "null";
            default -> raw;
        };
    }

    /**
     * Double-quoted string literal. Control characters and anything outside printable ASCII are escaped.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c > 0x7E) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}

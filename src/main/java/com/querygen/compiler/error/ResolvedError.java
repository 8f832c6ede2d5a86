package com.querygen.compiler.error;

import java.util.List;

import com.querygen.compiler.source.SourceLocation;

import lombok.NonNull;
import lombok.Value;

/**
 * A validation error whose locations carry file/line/column and the literal source text.
 */
@Value
public class ResolvedError {

    @NonNull
    String message;

    @NonNull
    List<SourceLocation> locations;

    public ResolvedError(String message, List<SourceLocation> locations) {
        this.message = message;
        this.locations = List.copyOf(locations);
    }

    /**
     * Human readable rendering with a caret line under each span.
     */
    public String format() {
        StringBuilder sb = new StringBuilder(message);
        for (SourceLocation location : locations) {
            sb.append(System.lineSeparator())
                    .append("  at ").append(location)
                    .append(System.lineSeparator())
                    .append("    ").append(location.getLineText())
                    .append(System.lineSeparator())
                    .append("    ").append(" ".repeat(Math.max(0, location.getColumn() - 1)))
                    .append("^".repeat(Math.max(1, location.getText().length())));
        }
        return sb.toString();
    }
}

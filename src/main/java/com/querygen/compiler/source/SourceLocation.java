package com.querygen.compiler.source;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A location resolved against the source text: file, 1-based line/column and the literal spanned text.
 */
@Value
@Builder
public class SourceLocation {

    @NonNull
    String sourceKey;

    int line;
    int column;

    /** The exact text covered by the span. */
    @NonNull
    String text;

    /** The full source line containing the start of the span. */
    @NonNull
    String lineText;

    @Override
    public String toString() {
        return sourceKey + ":" + line + ":" + column;
    }
}

package com.querygen.compiler.source;

import lombok.Value;

/**
 * Half-open character range [start, end) inside one source text.
 */
@Value
public class Span {
    int start;
    int end;

    public static Span of(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        return new Span(start, end);
    }

    public int length() {
        return end - start;
    }
}

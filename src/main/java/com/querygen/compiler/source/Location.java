package com.querygen.compiler.source;

import lombok.NonNull;
import lombok.Value;

/**
 * Abstract source reference: a span inside a source unit identified by key.
 *
 * Not resolved to text until it is surfaced through {@link Sources#resolve(Location)}.
 */
@Value
public class Location {

    @NonNull
    String sourceKey;

    @NonNull
    Span span;

    public static Location of(String sourceKey, int start, int end) {
        return new Location(sourceKey, Span.of(start, end));
    }

    @Override
    public String toString() {
        return sourceKey + ":" + span.getStart() + "-" + span.getEnd();
    }
}

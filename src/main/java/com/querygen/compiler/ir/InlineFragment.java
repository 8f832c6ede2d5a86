package com.querygen.compiler.ir;

import java.util.List;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Inline fragment. A missing type condition in the document is filled with the parent type.
 */
@Value
@Builder(toBuilder = true)
public class InlineFragment implements Selection {
    @NonNull
    String typeCondition;
    @Singular
    List<Directive> directives;
    @Singular
    List<Selection> selections;
    @NonNull
    Location location;

    public InlineFragment withSelections(List<Selection> newSelections) {
        return toBuilder().clearSelections().selections(newSelections).build();
    }
}

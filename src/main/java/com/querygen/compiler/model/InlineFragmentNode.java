package com.querygen.compiler.model;

import java.util.List;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Inline fragment; {@code typeCondition} is null for {@code ... @include(if: $x) { }} style fragments.
 */
@Value
@Builder
public class InlineFragmentNode implements SelectionNode {
    String typeCondition;
    @NonNull
    Location location;
    @Singular
    List<DirectiveNode> directives;
    @Singular
    List<SelectionNode> selections;
}

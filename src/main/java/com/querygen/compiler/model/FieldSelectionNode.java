package com.querygen.compiler.model;

import java.util.List;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A field selection. {@code location} spans the field name; {@code aliasLocation} the alias, if any.
 */
@Value
@Builder
public class FieldSelectionNode implements SelectionNode {
    String alias;
    Location aliasLocation;
    @NonNull
    String name;
    @NonNull
    Location location;
    @Singular
    List<ArgumentNode> arguments;
    @Singular
    List<DirectiveNode> directives;
    @Singular
    List<SelectionNode> selections;
    boolean hasSelectionSet;

    public String getResponseKey() {
        return alias != null ? alias : name;
    }
}

package com.querygen.compiler.model;

import java.util.List;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class FragmentSpreadNode implements SelectionNode {
    @NonNull
    String name;
    @NonNull
    Location location;
    @Singular
    List<DirectiveNode> directives;
}

package com.querygen.compiler.model;

import java.util.List;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class FragmentDefinitionNode implements ExecutableDefinitionNode {
    @NonNull
    String name;
    @NonNull
    Location location;
    @NonNull
    String typeCondition;
    @NonNull
    Location typeConditionLocation;
    @Singular
    List<DirectiveNode> directives;
    @Singular
    List<SelectionNode> selections;
}

package com.querygen.compiler.model;

import java.util.List;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * {@code location} spans the operation name, or the operation keyword for anonymous operations.
 */
@Value
@Builder(toBuilder = true)
public class OperationDefinitionNode implements ExecutableDefinitionNode {
    @NonNull
    OperationKind kind;
    String name;
    @NonNull
    Location location;
    @Singular
    List<VariableDefinitionNode> variableDefinitions;
    @Singular
    List<DirectiveNode> directives;
    @Singular
    List<SelectionNode> selections;
}

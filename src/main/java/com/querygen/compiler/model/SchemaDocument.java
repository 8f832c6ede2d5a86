package com.querygen.compiler.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A parsed SDL file.
 */
@Value
@Builder
public class SchemaDocument {
    @NonNull
    String sourceKey;
    @Singular
    List<TypeDefinitionNode> types;
    @Singular
    List<DirectiveDefinitionNode> directives;
    /** Explicit {@code schema { query: X }} root types, if declared. */
    @Singular
    Map<OperationKind, String> rootTypes;
}

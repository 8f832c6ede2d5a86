package com.querygen.compiler.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A parsed document file holding operations and fragments.
 */
@Value
@Builder
public class ExecutableDocument {
    @NonNull
    String sourceKey;
    @Singular
    List<ExecutableDefinitionNode> definitions;
}

package com.querygen.compiler.codegen.ast;

import com.querygen.compiler.model.OperationKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Parameters the runtime sends to the server. Exactly one of {@code id} and {@code text} is set.
 */
@Value
@Builder
public class RequestParameters {
    @NonNull
    String name;
    @NonNull
    OperationKind operationKind;
    @NonNull
    String cacheId;
    String id;
    String text;
}

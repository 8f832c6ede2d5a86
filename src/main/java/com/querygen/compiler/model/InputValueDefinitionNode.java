package com.querygen.compiler.model;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Field argument or input object field declaration.
 */
@Value
@Builder
public class InputValueDefinitionNode {
    @NonNull
    String name;
    @NonNull
    Location location;
    @NonNull
    TypeRef type;
    ValueNode defaultValue;
}

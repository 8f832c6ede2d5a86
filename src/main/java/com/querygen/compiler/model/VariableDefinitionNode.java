package com.querygen.compiler.model;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class VariableDefinitionNode {
    @NonNull
    String name;
    @NonNull
    Location location;
    @NonNull
    TypeRef type;
    @NonNull
    Location typeLocation;
    ValueNode defaultValue;
}

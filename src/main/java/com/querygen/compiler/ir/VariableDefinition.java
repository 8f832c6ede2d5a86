package com.querygen.compiler.ir;

import com.querygen.compiler.model.TypeRef;
import com.querygen.compiler.model.ValueNode;
import com.querygen.compiler.source.Location;

import lombok.NonNull;
import lombok.Value;

@Value
public class VariableDefinition {
    @NonNull
    String name;
    @NonNull
    TypeRef type;
    ValueNode defaultValue;
    @NonNull
    Location location;
}

package com.querygen.compiler.ir;

import com.querygen.compiler.model.TypeRef;
import com.querygen.compiler.model.ValueNode;
import com.querygen.compiler.source.Location;

import lombok.NonNull;
import lombok.Value;

/**
 * Argument value together with the type the schema expects for it.
 */
@Value
public class Argument {
    @NonNull
    String name;
    @NonNull
    TypeRef type;
    @NonNull
    ValueNode value;
    @NonNull
    Location location;
}

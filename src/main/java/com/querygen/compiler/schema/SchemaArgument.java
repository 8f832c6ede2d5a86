package com.querygen.compiler.schema;

import com.querygen.compiler.model.TypeRef;
import com.querygen.compiler.model.ValueNode;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class SchemaArgument {
    @NonNull
    String name;
    @NonNull
    TypeRef type;
    ValueNode defaultValue;

    public boolean isRequired() {
        return type.isNonNull() && defaultValue == null;
    }
}

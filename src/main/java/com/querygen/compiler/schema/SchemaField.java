package com.querygen.compiler.schema;

import java.util.List;
import java.util.Optional;

import com.querygen.compiler.model.TypeRef;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class SchemaField {
    @NonNull
    String name;
    @NonNull
    TypeRef type;
    @Singular
    List<SchemaArgument> arguments;
    /** Declared by a project extension rather than the base schema. */
    boolean clientExtension;

    public Optional<SchemaArgument> getArgument(String argumentName) {
        return arguments.stream().filter(a -> a.getName().equals(argumentName)).findFirst();
    }
}

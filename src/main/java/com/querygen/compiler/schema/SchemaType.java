package com.querygen.compiler.schema;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.querygen.compiler.model.TypeKind;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A named type in a built {@link Schema}.
 */
@Value
@Builder(toBuilder = true)
public class SchemaType {
    @NonNull
    TypeKind kind;
    @NonNull
    String name;
    /** Fields by name in declaration order (objects and interfaces). */
    @Singular
    Map<String, SchemaField> fields;
    /** Input fields by name (input objects). */
    @Singular
    Map<String, SchemaArgument> inputFields;
    @Singular("implementedInterface")
    List<String> interfaces;
    /** Union members, or implementing object types for interfaces. */
    @Singular
    List<String> possibleTypes;
    @Singular
    List<String> enumValues;
    boolean clientExtension;

    public Optional<SchemaField> getField(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    public boolean isInputType() {
        return kind == TypeKind.SCALAR || kind == TypeKind.ENUM || kind == TypeKind.INPUT_OBJECT;
    }
}

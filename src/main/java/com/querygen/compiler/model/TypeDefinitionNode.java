package com.querygen.compiler.model;

import java.util.List;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A type declaration or an {@code extend type} block in SDL.
 */
@Value
@Builder
public class TypeDefinitionNode {
    @NonNull
    TypeKind kind;
    @NonNull
    String name;
    @NonNull
    Location location;
    boolean extension;
    @Singular("implementedInterface")
    List<String> interfaces;
    @Singular
    List<FieldDefinitionNode> fields;
    @Singular
    List<InputValueDefinitionNode> inputFields;
    @Singular
    List<String> enumValues;
    @Singular
    List<String> members;
}

package com.querygen.compiler.ir;

import java.util.List;

import com.querygen.compiler.model.TypeRef;
import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Field of composite type with its own selection set.
 */
@Value
@Builder(toBuilder = true)
public class LinkedField implements Selection {
    String alias;
    @NonNull
    String name;
    @NonNull
    TypeRef type;
    @Singular
    List<Argument> arguments;
    @Singular
    List<Directive> directives;
    @Singular
    List<Selection> selections;
    @NonNull
    Location location;
    Location aliasLocation;

    public String getResponseKey() {
        return alias != null ? alias : name;
    }

    public LinkedField withSelections(List<Selection> newSelections) {
        return toBuilder().clearSelections().selections(newSelections).build();
    }
}

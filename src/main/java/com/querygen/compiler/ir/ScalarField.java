package com.querygen.compiler.ir;

import java.util.List;

import com.querygen.compiler.model.TypeRef;
import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Field of scalar or enum type.
 */
@Value
@Builder(toBuilder = true)
public class ScalarField implements Selection {
    String alias;
    @NonNull
    String name;
    @NonNull
    TypeRef type;
    @Singular
    List<Argument> arguments;
    @Singular
    List<Directive> directives;
    @NonNull
    Location location;
    Location aliasLocation;

    public String getResponseKey() {
        return alias != null ? alias : name;
    }
}

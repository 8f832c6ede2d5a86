package com.querygen.compiler.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Reference to a schema type with list and non-null wrappers, e.g. {@code [ID!]!}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TypeRef {

    public enum Wrapper {
        NAMED,
        LIST,
        NON_NULL
    }

    Wrapper wrapper;
    String name;
    TypeRef ofType;

    public static TypeRef named(String name) {
        return new TypeRef(Wrapper.NAMED, name, null);
    }

    public static TypeRef list(TypeRef ofType) {
        return new TypeRef(Wrapper.LIST, null, ofType);
    }

    public static TypeRef nonNull(TypeRef ofType) {
        return new TypeRef(Wrapper.NON_NULL, null, ofType);
    }

    public boolean isNonNull() {
        return wrapper == Wrapper.NON_NULL;
    }

    public boolean isList() {
        return wrapper == Wrapper.LIST || (wrapper == Wrapper.NON_NULL && ofType.isList());
    }

    /** Innermost named type. */
    public String getNamedType() {
        return wrapper == Wrapper.NAMED ? name : ofType.getNamedType();
    }

    @Override
    public String toString() {
        return switch (wrapper) {
            case NAMED -> name;
            case LIST -> "[" + ofType + "]";
            case NON_NULL -> ofType + "!";
        };
    }
}

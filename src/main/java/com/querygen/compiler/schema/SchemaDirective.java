package com.querygen.compiler.schema;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class SchemaDirective {
    @NonNull
    String name;
    @Singular
    List<SchemaArgument> arguments;
    /** Allowed locations, e.g. FIELD, FRAGMENT_SPREAD, QUERY. */
    @Singular
    Set<String> locations;

    public Optional<SchemaArgument> getArgument(String argumentName) {
        return arguments.stream().filter(a -> a.getName().equals(argumentName)).findFirst();
    }
}

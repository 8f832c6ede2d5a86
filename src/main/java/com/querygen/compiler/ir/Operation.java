package com.querygen.compiler.ir;

import java.util.List;

import com.querygen.compiler.model.OperationKind;
import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Operation implements ExecutableDefinition {
    @NonNull
    OperationKind kind;
    @NonNull
    String name;
    @NonNull
    String rootType;
    @Singular
    List<VariableDefinition> variableDefinitions;
    @Singular
    List<Directive> directives;
    @Singular
    List<Selection> selections;
    @NonNull
    Location location;

    @Override
    public String getTypeName() {
        return rootType;
    }

    @Override
    public Operation withSelections(List<Selection> newSelections) {
        return toBuilder().clearSelections().selections(newSelections).build();
    }
}

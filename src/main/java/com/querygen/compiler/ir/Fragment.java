package com.querygen.compiler.ir;

import java.util.List;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class Fragment implements ExecutableDefinition {
    @NonNull
    String name;
    @NonNull
    String typeCondition;
    @Singular
    List<Directive> directives;
    @Singular
    List<Selection> selections;
    @NonNull
    Location location;

    @Override
    public String getTypeName() {
        return typeCondition;
    }

    @Override
    public Fragment withSelections(List<Selection> newSelections) {
        return toBuilder().clearSelections().selections(newSelections).build();
    }
}

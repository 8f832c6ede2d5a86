package com.querygen.compiler.ir;

import java.util.List;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class FragmentSpread implements Selection {
    @NonNull
    String name;
    @Singular
    List<Directive> directives;
    @NonNull
    Location location;
}

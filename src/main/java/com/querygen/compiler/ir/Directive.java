package com.querygen.compiler.ir;

import java.util.List;

import com.querygen.compiler.source.Location;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class Directive {
    @NonNull
    String name;
    @Singular
    List<Argument> arguments;
    @NonNull
    Location location;
}

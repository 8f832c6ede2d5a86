package com.querygen.compiler.model;

import com.querygen.compiler.source.Location;

import lombok.NonNull;
import lombok.Value;

@Value
public class ArgumentNode {
    @NonNull
    String name;
    @NonNull
    Location location;
    @NonNull
    ValueNode value;
}

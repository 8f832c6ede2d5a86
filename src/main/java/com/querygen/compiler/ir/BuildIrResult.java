package com.querygen.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.NonNull;
import lombok.Value;

/**
 * IR of one project and the names of the base-project fragments it pulled in.
 */
@Value
public class BuildIrResult {
    @NonNull
    List<ExecutableDefinition> definitions;
    @NonNull
    Set<String> baseFragmentNames;

    public BuildIrResult(List<ExecutableDefinition> definitions, Set<String> baseFragmentNames) {
        this.definitions = List.copyOf(definitions);
        this.baseFragmentNames = Collections.unmodifiableSet(new LinkedHashSet<>(baseFragmentNames));
    }
}

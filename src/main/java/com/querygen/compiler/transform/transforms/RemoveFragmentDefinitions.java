package com.querygen.compiler.transform.transforms;

import java.util.Set;

import com.querygen.compiler.ir.Operation;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.transform.ProgramTransform;

/**
 * Keeps operations only. Run after {@link InlineFragments}.
 */
public class RemoveFragmentDefinitions implements ProgramTransform {

    @Override
    public String getName() {
        return "remove_fragment_definitions";
    }

    @Override
    public Program apply(Program program, Set<String> baseFragmentNames) {
        return program.withDefinitions(program.getDefinitions().stream()
                .filter(Operation.class::isInstance)
                .toList());
    }
}

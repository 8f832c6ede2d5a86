package com.querygen.compiler.transform.transforms;

import java.util.Set;

import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.Fragment;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.transform.ProgramTransform;

/**
 * Drops fragments owned by the base project. Spreads of them stay in place.
 */
public class RemoveBaseFragments implements ProgramTransform {

    @Override
    public String getName() {
        return "remove_base_fragments";
    }

    @Override
    public Program apply(Program program, Set<String> baseFragmentNames) {
        if (baseFragmentNames.isEmpty()) {
            return program;
        }
        return program.withDefinitions(program.getDefinitions().stream()
                .filter(definition -> !isBaseFragment(definition, baseFragmentNames))
                .toList());
    }

    private static boolean isBaseFragment(ExecutableDefinition definition, Set<String> baseFragmentNames) {
        return definition instanceof Fragment && baseFragmentNames.contains(definition.getName());
    }
}

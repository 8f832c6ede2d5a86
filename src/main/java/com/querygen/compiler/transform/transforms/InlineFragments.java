package com.querygen.compiler.transform.transforms;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.Fragment;
import com.querygen.compiler.ir.FragmentSpread;
import com.querygen.compiler.ir.InlineFragment;
import com.querygen.compiler.ir.LinkedField;
import com.querygen.compiler.ir.Selection;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.transform.ProgramTransform;

/**
 * Replaces every fragment spread with an inline fragment carrying the fragment's selections.
 */
public class InlineFragments implements ProgramTransform {

    @Override
    public String getName() {
        return "inline_fragments";
    }

    @Override
    public Program apply(Program program, Set<String> baseFragmentNames) {
        Map<String, List<Selection>> inlined = new HashMap<>();
        List<ExecutableDefinition> definitions = new ArrayList<>();
        for (ExecutableDefinition definition : program.getDefinitions()) {
            definitions.add(definition.withSelections(
                    inline(program, definition.getSelections(), inlined, new ArrayList<>())));
        }
        return program.withDefinitions(definitions);
    }

    private List<Selection> inline(Program program, List<Selection> selections, Map<String, List<Selection>> inlined,
                                   List<String> path) {
        List<Selection> result = new ArrayList<>(selections.size());
        for (Selection selection : selections) {
            if (selection instanceof FragmentSpread spread) {
                Fragment fragment = program.getFragment(spread.getName())
                        .orElseThrow(() -> new IllegalStateException(
                                "Cannot inline unknown fragment '" + spread.getName() + "'"));
                result.add(InlineFragment.builder()
                        .typeCondition(fragment.getTypeCondition())
                        .directives(spread.getDirectives())
                        .selections(fragmentSelections(program, fragment, inlined, path))
                        .location(spread.getLocation())
                        .build());
            } else if (selection instanceof LinkedField linked) {
                result.add(linked.withSelections(inline(program, linked.getSelections(), inlined, path)));
            } else if (selection instanceof InlineFragment inlineFragment) {
                result.add(inlineFragment.withSelections(
                        inline(program, inlineFragment.getSelections(), inlined, path)));
            } else {
                result.add(selection);
            }
        }
        return result;
    }

    private List<Selection> fragmentSelections(Program program, Fragment fragment,
                                               Map<String, List<Selection>> inlined, List<String> path) {
        List<Selection> cached = inlined.get(fragment.getName());
        if (cached != null) {
            return cached;
        }
        if (path.contains(fragment.getName())) {
            throw new IllegalStateException("Fragment cycle through " + path + " -> " + fragment.getName());
        }
        path.add(fragment.getName());
        List<Selection> selections = inline(program, fragment.getSelections(), inlined, path);
        path.remove(path.size() - 1);
        inlined.put(fragment.getName(), selections);
        return selections;
    }
}

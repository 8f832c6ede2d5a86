package com.querygen.compiler.transform.transforms;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.querygen.compiler.ir.Argument;
import com.querygen.compiler.ir.Directive;
import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.FragmentSpread;
import com.querygen.compiler.ir.InlineFragment;
import com.querygen.compiler.ir.LinkedField;
import com.querygen.compiler.ir.ScalarField;
import com.querygen.compiler.ir.Selection;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.transform.ProgramTransform;

/**
 * Removes selections that repeat an earlier sibling. Repeated linked fields and inline fragments are
 * merged into the first occurrence, so the surviving order is that of first appearance.
 */
public class SkipRedundantNodes implements ProgramTransform {

    @Override
    public String getName() {
        return "skip_redundant_nodes";
    }

    @Override
    public Program apply(Program program, Set<String> baseFragmentNames) {
        List<ExecutableDefinition> definitions = new ArrayList<>();
        for (ExecutableDefinition definition : program.getDefinitions()) {
            definitions.add(definition.withSelections(dedupe(definition.getSelections())));
        }
        return program.withDefinitions(definitions);
    }

    private List<Selection> dedupe(List<Selection> selections) {
        Map<String, Selection> unique = new LinkedHashMap<>();
        for (Selection selection : selections) {
            String key = identity(selection);
            Selection previous = unique.get(key);
            if (previous == null) {
                unique.put(key, selection);
            } else if (previous instanceof LinkedField first) {
                unique.put(key, first.withSelections(concat(first.getSelections(),
                        ((LinkedField) selection).getSelections())));
            } else if (previous instanceof InlineFragment first) {
                unique.put(key, first.withSelections(concat(first.getSelections(),
                        ((InlineFragment) selection).getSelections())));
            }
        }

        List<Selection> result = new ArrayList<>(unique.size());
        for (Selection selection : unique.values()) {
            if (selection instanceof LinkedField linked) {
                result.add(linked.withSelections(dedupe(linked.getSelections())));
            } else if (selection instanceof InlineFragment inline) {
                result.add(inline.withSelections(dedupe(inline.getSelections())));
            } else {
                result.add(selection);
            }
        }
        return result;
    }

    private static List<Selection> concat(List<Selection> a, List<Selection> b) {
        List<Selection> merged = new ArrayList<>(a);
        merged.addAll(b);
        return merged;
    }

    /**
     * Two selections with equal identity fetch the same data under the same conditions.
     */
    private static String identity(Selection selection) {
        if (selection instanceof ScalarField field) {
            return "S:" + field.getResponseKey() + ":" + field.getName() + arguments(field.getArguments())
                    + directives(field.getDirectives());
        }
        if (selection instanceof LinkedField field) {
            return "L:" + field.getResponseKey() + ":" + field.getName() + arguments(field.getArguments())
                    + directives(field.getDirectives());
        }
        if (selection instanceof FragmentSpread spread) {
            return "F:" + spread.getName() + directives(spread.getDirectives());
        }
        InlineFragment inline = (InlineFragment) selection;
        return "I:" + inline.getTypeCondition() + directives(inline.getDirectives());
    }

    private static String arguments(List<Argument> arguments) {
        return arguments.stream()
                .map(argument -> argument.getName() + ":" + argument.getValue().print())
                .sorted()
                .collect(Collectors.joining(",", "(", ")"));
    }

    private static String directives(List<Directive> directives) {
        return directives.stream()
                .map(directive -> "@" + directive.getName() + arguments(directive.getArguments()))
                .collect(Collectors.joining());
    }
}

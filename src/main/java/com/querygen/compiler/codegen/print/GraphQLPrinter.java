package com.querygen.compiler.codegen.print;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import com.querygen.compiler.ir.Argument;
import com.querygen.compiler.ir.Directive;
import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.Fragment;
import com.querygen.compiler.ir.FragmentSpread;
import com.querygen.compiler.ir.InlineFragment;
import com.querygen.compiler.ir.LinkedField;
import com.querygen.compiler.ir.Operation;
import com.querygen.compiler.ir.ScalarField;
import com.querygen.compiler.ir.Selection;
import com.querygen.compiler.ir.Selections;
import com.querygen.compiler.ir.VariableDefinition;
import com.querygen.compiler.program.Program;

/**
 * Prints IR back to GraphQL text, two-space indented.
 */
public class GraphQLPrinter {

    private static final String INDENT = "  ";

    /**
     * Full request text of an operation: the operation followed by every fragment it reaches, sorted by name.
     *
     * @throws IllegalStateException if a spread fragment is missing from the program
     */
    public String printOperationText(Program program, Operation operation) {
        StringBuilder text = new StringBuilder(print(operation));
        for (String fragmentName : reachableFragments(program, operation)) {
            Fragment fragment = program.getFragment(fragmentName)
                    .orElseThrow(() -> new IllegalStateException(
                            "Operation " + operation.getName() + " spreads unknown fragment " + fragmentName));
            text.append("\n\n").append(print(fragment));
        }
        return text.append('\n').toString();
    }

    public String print(ExecutableDefinition definition) {
        StringBuilder out = new StringBuilder();
        if (definition instanceof Operation operation) {
            out.append(operation.getKind().keyword()).append(' ').append(operation.getName());
            if (!operation.getVariableDefinitions().isEmpty()) {
                out.append(operation.getVariableDefinitions().stream()
                        .map(GraphQLPrinter::variable)
                        .collect(Collectors.joining(", ", "(", ")")));
            }
        } else {
            Fragment fragment = (Fragment) definition;
            out.append("fragment ").append(fragment.getName()).append(" on ").append(fragment.getTypeCondition());
        }
        out.append(directives(definition.getDirectives()));
        out.append(' ');
        selectionSet(definition.getSelections(), 0, out);
        return out.toString();
    }

    private static Set<String> reachableFragments(Program program, ExecutableDefinition root) {
        Set<String> names = new TreeSet<>();
        List<ExecutableDefinition> pending = new ArrayList<>(List.of(root));
        while (!pending.isEmpty()) {
            ExecutableDefinition next = pending.remove(pending.size() - 1);
            Selections.forEach(next.getSelections(), selection -> {
                if (selection instanceof FragmentSpread spread && names.add(spread.getName())) {
                    program.getFragment(spread.getName()).ifPresent(pending::add);
                }
            });
        }
        return names;
    }

    private static void selectionSet(List<Selection> selections, int depth, StringBuilder out) {
        out.append("{\n");
        String indent = INDENT.repeat(depth + 1);
        for (Selection selection : selections) {
            out.append(indent);
            if (selection instanceof ScalarField field) {
                out.append(fieldHead(field.getAlias(), field.getName(), field.getArguments(), field.getDirectives()));
            } else if (selection instanceof LinkedField field) {
                out.append(fieldHead(field.getAlias(), field.getName(), field.getArguments(), field.getDirectives()))
                        .append(' ');
                selectionSet(field.getSelections(), depth + 1, out);
            } else if (selection instanceof FragmentSpread spread) {
                out.append("...").append(spread.getName()).append(directives(spread.getDirectives()));
            } else if (selection instanceof InlineFragment inline) {
                out.append("... on ").append(inline.getTypeCondition()).append(directives(inline.getDirectives()))
                        .append(' ');
                selectionSet(inline.getSelections(), depth + 1, out);
            }
            out.append('\n');
        }
        out.append(INDENT.repeat(depth)).append('}');
    }

    private static String fieldHead(String alias, String name, List<Argument> arguments, List<Directive> directives) {
        StringBuilder head = new StringBuilder();
        if (alias != null) {
            head.append(alias).append(": ");
        }
        return head.append(name).append(arguments(arguments)).append(directives(directives)).toString();
    }

    private static String arguments(List<Argument> arguments) {
        if (arguments.isEmpty()) {
            return "";
        }
        return arguments.stream()
                .map(argument -> argument.getName() + ": " + argument.getValue().print())
                .collect(Collectors.joining(", ", "(", ")"));
    }

    private static String directives(List<Directive> directives) {
        return directives.stream()
                .map(directive -> " @" + directive.getName() + arguments(directive.getArguments()))
                .collect(Collectors.joining());
    }

    private static String variable(VariableDefinition variable) {
        String printed = "$" + variable.getName() + ": " + variable.getType();
        return variable.getDefaultValue() == null ? printed : printed + " = " + variable.getDefaultValue().print();
    }
}

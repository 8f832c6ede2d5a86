package com.querygen.compiler.validate.rules;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.ir.Directive;
import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.FragmentSpread;
import com.querygen.compiler.ir.InlineFragment;
import com.querygen.compiler.ir.Operation;
import com.querygen.compiler.ir.Selection;
import com.querygen.compiler.ir.Selections;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.schema.Schema;
import com.querygen.compiler.schema.SchemaDirective;
import com.querygen.compiler.validate.ValidationRule;

/**
 * Directives must be used where their declaration allows, at most once per node.
 */
public class DirectiveUsageRule implements ValidationRule {

    @Override
    public String getName() {
        return "directive_usage";
    }

    @Override
    public List<ValidationError> check(Program program) {
        List<ValidationError> errors = new ArrayList<>();
        Schema schema = program.getSchema();
        for (ExecutableDefinition definition : program.getDefinitions()) {
            String definitionLocation = definition instanceof Operation operation
                    ? operation.getKind().name()
                    : "FRAGMENT_DEFINITION";
            check(schema, definition.getDirectives(), definitionLocation, errors);

            Selections.forEach(definition.getSelections(),
                    selection -> check(schema, selection.getDirectives(), locationOf(selection), errors));
        }
        return errors;
    }

    private static String locationOf(Selection selection) {
        if (selection instanceof FragmentSpread) {
            return "FRAGMENT_SPREAD";
        }
        if (selection instanceof InlineFragment) {
            return "INLINE_FRAGMENT";
        }
        return "FIELD";
    }

    private static void check(Schema schema, List<Directive> directives, String location,
                              List<ValidationError> errors) {
        Set<String> seen = new HashSet<>();
        for (Directive directive : directives) {
            if (!seen.add(directive.getName())) {
                errors.add(ValidationError.of("Directive '@" + directive.getName()
                        + "' may not be used more than once on the same node", directive.getLocation()));
            }
            boolean allowed = schema.getDirective(directive.getName())
                    .map(SchemaDirective::getLocations)
                    .map(locations -> locations.contains(location))
                    .orElse(true);
            if (!allowed) {
                errors.add(ValidationError.of("Directive '@" + directive.getName() + "' may not be used on "
                        + location, directive.getLocation()));
            }
        }
    }
}

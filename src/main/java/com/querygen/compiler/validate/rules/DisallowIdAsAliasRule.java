package com.querygen.compiler.validate.rules;

import java.util.ArrayList;
import java.util.List;

import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.LinkedField;
import com.querygen.compiler.ir.ScalarField;
import com.querygen.compiler.ir.Selections;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.source.Location;
import com.querygen.compiler.validate.ValidationRule;

/**
 * The response key {@code id} is reserved for the {@code id} field; the normalized store keys records by it.
 */
public class DisallowIdAsAliasRule implements ValidationRule {

    private static final String ID = "id";

    @Override
    public String getName() {
        return "disallow_id_as_alias";
    }

    @Override
    public List<ValidationError> check(Program program) {
        List<ValidationError> errors = new ArrayList<>();
        for (ExecutableDefinition definition : program.getDefinitions()) {
            Selections.forEach(definition.getSelections(), selection -> {
                if (selection instanceof ScalarField field) {
                    check(field.getAlias(), field.getName(), field.getAliasLocation(), errors);
                } else if (selection instanceof LinkedField field) {
                    check(field.getAlias(), field.getName(), field.getAliasLocation(), errors);
                }
            });
        }
        return errors;
    }

    private static void check(String alias, String name, Location aliasLocation, List<ValidationError> errors) {
        if (ID.equals(alias) && !ID.equals(name)) {
            errors.add(ValidationError.of("The alias 'id' may only be used on the field 'id', found '" + name + "'",
                    aliasLocation));
        }
    }
}

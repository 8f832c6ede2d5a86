package com.querygen.compiler.validate.rules;

import java.util.ArrayList;
import java.util.List;

import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.Operation;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.validate.ValidationRule;

/**
 * Definition names must be prefixed by the module name of the document declaring them.
 *
 * The module name is the file name up to its first dot, with every non-alphanumeric character dropped
 * and the letter after it upper-cased: {@code user-profile.graphql} gives {@code userProfile}.
 * Operation names must also end with their kind, e.g. {@code userProfileQuery}.
 */
public class ModuleNameRule implements ValidationRule {

    @Override
    public String getName() {
        return "module_name";
    }

    @Override
    public List<ValidationError> check(Program program) {
        List<ValidationError> errors = new ArrayList<>();
        for (ExecutableDefinition definition : program.getDefinitions()) {
            String module = moduleName(definition.getLocation().getSourceKey());
            String name = definition.getName();

            if (definition instanceof Operation operation) {
                String suffix = operation.getKind().nameSuffix();
                if (!name.startsWith(module) || !name.endsWith(suffix)) {
                    errors.add(ValidationError.of("Operation names in module '" + module + "' must be of the form '"
                            + module + "<Name>" + suffix + "', got '" + name + "'", definition.getLocation()));
                }
            } else if (!name.startsWith(module)) {
                errors.add(ValidationError.of("Fragment names in module '" + module + "' must be prefixed with '"
                        + module + "', got '" + name + "'", definition.getLocation()));
            }
        }
        return errors;
    }

    /**
     * Module name of a source key such as {@code src/user-profile.graphql}.
     */
    public static String moduleName(String sourceKey) {
        String fileName = sourceKey.substring(sourceKey.lastIndexOf('/') + 1);
        int dot = fileName.indexOf('.');
        String stem = dot >= 0 ? fileName.substring(0, dot) : fileName;

        StringBuilder module = new StringBuilder();
        boolean upperNext = false;
        for (char c : stem.toCharArray()) {
            if (!Character.isLetterOrDigit(c)) {
                upperNext = module.length() > 0;
                continue;
            }
            module.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = false;
        }
        return module.toString();
    }
}

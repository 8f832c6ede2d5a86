package com.querygen.compiler.validate.rules;

import java.util.ArrayList;
import java.util.List;

import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.InlineFragment;
import com.querygen.compiler.ir.LinkedField;
import com.querygen.compiler.ir.Selection;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.validate.ValidationRule;

/**
 * Caps how deeply linked fields may nest inside one definition. Inline fragments do not add a level and
 * fragment spreads are measured in their own definition.
 */
public class SelectionDepthRule implements ValidationRule {

    private final int maxDepth;

    public SelectionDepthRule(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    @Override
    public String getName() {
        return "selection_depth";
    }

    @Override
    public List<ValidationError> check(Program program) {
        List<ValidationError> errors = new ArrayList<>();
        for (ExecutableDefinition definition : program.getDefinitions()) {
            LinkedField offending = tooDeep(definition.getSelections(), 1);
            if (offending != null) {
                errors.add(ValidationError.of("Selections of '" + definition.getName() + "' nest deeper than "
                        + maxDepth + " levels", offending.getLocation()));
            }
        }
        return errors;
    }

    /**
     * First linked field whose selections sit below {@code maxDepth}, or null.
     */
    private LinkedField tooDeep(List<Selection> selections, int depth) {
        for (Selection selection : selections) {
            if (selection instanceof LinkedField linked) {
                if (depth >= maxDepth) {
                    return linked;
                }
                LinkedField nested = tooDeep(linked.getSelections(), depth + 1);
                if (nested != null) {
                    return nested;
                }
            } else if (selection instanceof InlineFragment inline) {
                LinkedField nested = tooDeep(inline.getSelections(), depth);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }
}

package com.querygen.compiler.validate;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.validate.rules.DirectiveUsageRule;
import com.querygen.compiler.validate.rules.DisallowIdAsAliasRule;
import com.querygen.compiler.validate.rules.ModuleNameRule;
import com.querygen.compiler.validate.rules.SelectionDepthRule;

/**
 * Runs every rule and concatenates their errors in rule order. One failing rule never stops the others.
 */
public class RuleBasedValidator implements ProgramValidator {
    private static final Logger log = LoggerFactory.getLogger(RuleBasedValidator.class);

    private final List<ValidationRule> rules;

    public RuleBasedValidator(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RuleBasedValidator withDefaultRules(int maxSelectionDepth) {
        return new RuleBasedValidator(List.of(
                new ModuleNameRule(),
                new DisallowIdAsAliasRule(),
                new DirectiveUsageRule(),
                new SelectionDepthRule(maxSelectionDepth)));
    }

    public List<ValidationRule> getRules() {
        return rules;
    }

    @Override
    public List<ValidationError> validate(Program program) {
        List<ValidationError> errors = new ArrayList<>();
        for (ValidationRule rule : rules) {
            List<ValidationError> found = rule.check(program);
            if (!found.isEmpty()) {
                log.debug("Rule {} reported {} error(s)", rule.getName(), found.size());
                errors.addAll(found);
            }
        }
        return errors;
    }
}

package com.querygen.compiler.validate;

import java.util.List;

import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.program.Program;

/**
 * A single named rule run by {@link RuleBasedValidator}.
 */
public interface ValidationRule {

    String getName();

    List<ValidationError> check(Program program);
}

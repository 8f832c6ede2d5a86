package com.querygen.compiler.validate;

import java.util.List;

import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.program.Program;

/**
 * Semantic checks that go beyond type checking.
 */
public interface ProgramValidator {

    /**
     * @return every violation found; empty when the program is valid
     */
    List<ValidationError> validate(Program program);
}

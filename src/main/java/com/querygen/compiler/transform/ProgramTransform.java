package com.querygen.compiler.transform;

import java.util.Set;

import com.querygen.compiler.program.Program;

/**
 * A pure Program to Program function. Implementations must not keep state between calls.
 *
 * Broken internal invariants are defects and surface as {@link IllegalStateException}.
 */
public interface ProgramTransform {

    String getName();

    Program apply(Program program, Set<String> baseFragmentNames);
}

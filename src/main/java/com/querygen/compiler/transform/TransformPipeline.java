package com.querygen.compiler.transform;

import java.util.Set;

import com.querygen.compiler.program.Program;

/**
 * Fans a validated program out into one program per target.
 */
public interface TransformPipeline {

    TargetPrograms apply(Program program, Set<String> baseFragmentNames);
}

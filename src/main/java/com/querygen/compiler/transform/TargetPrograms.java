package com.querygen.compiler.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.querygen.compiler.program.Program;

/**
 * Programs derived from one validated program, keyed by target name in chain order.
 */
public final class TargetPrograms {

    public static final String READER = "reader";
    public static final String NORMALIZATION = "normalization";
    public static final String OPERATION_TEXT = "operation_text";

    private final Map<String, Program> programs;

    public TargetPrograms(Map<String, Program> programs) {
        this.programs = Collections.unmodifiableMap(new LinkedHashMap<>(programs));
    }

    public Map<String, Program> asMap() {
        return programs;
    }

    /**
     * @throws IllegalStateException if no chain produced the target
     */
    public Program get(String target) {
        Program program = programs.get(target);
        if (program == null) {
            throw new IllegalStateException("No program for target '" + target + "'");
        }
        return program;
    }

    public Program getReader() {
        return get(READER);
    }

    public Program getNormalization() {
        return get(NORMALIZATION);
    }

    public Program getOperationText() {
        return get(OPERATION_TEXT);
    }
}

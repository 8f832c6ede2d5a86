package com.querygen.compiler.build;

/**
 * Stages of a project build, in execution order.
 */
public enum BuildStage {
    BUILD_SCHEMA("build_schema"),
    BUILD_IR("build_ir"),
    BUILD_PROGRAM("build_program"),
    VALIDATE("validate"),
    APPLY_TRANSFORMS("apply_transforms"),
    GENERATE_ARTIFACTS("generate_artifacts"),
    WRITE_ARTIFACTS("write_artifacts");

    private final String label;

    BuildStage(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /** Timing span label, e.g. {@code build_ir web}. */
    public String spanLabel(String projectName) {
        return label + " " + projectName;
    }
}

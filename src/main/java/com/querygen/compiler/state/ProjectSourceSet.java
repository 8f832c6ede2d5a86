package com.querygen.compiler.state;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Source keys belonging to one project, split by role.
 */
@Value
@Builder
public class ProjectSourceSet {

    @NonNull
    String projectName;

    @Singular
    List<String> schemaKeys;

    @Singular
    List<String> extensionKeys;

    @Singular
    List<String> documentKeys;
}

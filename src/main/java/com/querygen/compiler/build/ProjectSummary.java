package com.querygen.compiler.build;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Definition counts of each target program plus the number of artifacts produced.
 */
@Value
@Builder
public class ProjectSummary {
    @NonNull
    String projectName;
    int readerCount;
    int normalizationCount;
    int operationTextCount;
    int artifactCount;

    public String toLine() {
        return String.format("[%s] documents: %d reader, %d normalization, %d operation",
                projectName, readerCount, normalizationCount, operationTextCount);
    }
}

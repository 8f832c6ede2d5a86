package com.querygen.compiler.ir;

import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.StageResult;
import com.querygen.compiler.schema.Schema;
import com.querygen.compiler.state.AstSets;

/**
 * Type-checks a project's documents against its schema.
 */
public interface IrBuilder {

    /**
     * @return the IR, or every type error found across all documents
     */
    StageResult<BuildIrResult> build(ProjectConfig project, Schema schema, AstSets astSets);
}

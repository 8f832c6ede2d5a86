package com.querygen.compiler.schema;

import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.SchemaBuildException;
import com.querygen.compiler.state.CompilerState;

/**
 * Builds a project's schema from the texts captured in {@link CompilerState}.
 *
 * Implementations must be pure and thread-safe.
 */
public interface SchemaBuilder {

    /**
     * @throws SchemaBuildException when the schema or its extensions are malformed or conflict
     */
    Schema build(CompilerState state, ProjectConfig project);
}

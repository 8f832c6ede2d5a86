package com.querygen.compiler.error;

import java.util.List;

/**
 * Malformed schema or project extensions that conflict with the base schema.
 */
public class SchemaBuildException extends BuildProjectException {

    private static final long serialVersionUID = 1L;

    public SchemaBuildException(List<String> problems) {
        super(problems);
    }
}

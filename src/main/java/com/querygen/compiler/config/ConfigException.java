package com.querygen.compiler.config;

import java.util.List;

/**
 * Invalid or unreadable configuration file. Holds every problem found.
 */
public class ConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public ConfigException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigException(String error, Throwable cause) {
        super(error, cause);
        this.errors = List.of(error);
    }

    public List<String> getErrors() {
        return errors;
    }
}

package com.querygen.compiler.parser;

import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.source.Location;

import lombok.Getter;

/**
 * Syntax error at a known location.
 */
@Getter
public class ParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Location location;

    public ParseException(String message, Location location) {
        super(message);
        this.location = location;
    }

    public ValidationError toValidationError() {
        return ValidationError.of("Syntax error: " + getMessage(), location);
    }
}

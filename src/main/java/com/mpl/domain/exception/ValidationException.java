package com.mpl.domain.exception;

import java.util.List;

/**
 * Input rejected before any mutation; carries every human-readable problem found
 */
public class ValidationException extends IllegalArgumentException {

    private final List<String> errors;

    public ValidationException(List<String> errors) {
        super("Validation failed: " + errors);
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String error) {
        this(List.of(error));
    }

    public List<String> getErrors() {
        return errors;
    }
}

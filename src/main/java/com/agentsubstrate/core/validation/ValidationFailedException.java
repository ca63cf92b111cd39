package com.agentsubstrate.core.validation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when an agent input, an agent output or a decision event does not satisfy its schema.
 */
public class ValidationFailedException extends RuntimeException {

    private final List<FieldError> errors;

    public ValidationFailedException(List<FieldError> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    public ValidationFailedException(String message) {
        this(List.of(new FieldError("", message)));
    }

    public ValidationFailedException(List<FieldError> errors, Throwable cause) {
        super(describe(errors), cause);
        this.errors = List.copyOf(errors);
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    private static String describe(List<FieldError> errors) {
        return "Validation failed: " + errors.stream()
                .map(FieldError::toString)
                .collect(Collectors.joining("; "));
    }
}

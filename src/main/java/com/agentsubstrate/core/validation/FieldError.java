package com.agentsubstrate.core.validation;

/**
 * One structural or range violation found while validating a value.
 *
 * @param path    dotted property path, e.g. {@code config.max_questions} or {@code traces[3].reported_confidence}
 * @param message human readable reason
 */
public record FieldError(String path, String message) {

    @Override
    public String toString() {
        return path.isEmpty() ? message : path + ": " + message;
    }
}

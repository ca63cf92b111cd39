package com.agentsubstrate.core.trace;

/**
 * Thrown when an execution graph is created without the caller's parent span.
 */
public class MissingParentSpanException extends RuntimeException {

    public MissingParentSpanException(String message) {
        super(message);
    }
}

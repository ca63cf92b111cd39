package com.agentsubstrate.core.trace;

/**
 * Thrown when a repo span is completed before any agent span was recorded under it.
 */
public class InvalidExecutionException extends RuntimeException {

    public InvalidExecutionException(String message) {
        super(message);
    }
}

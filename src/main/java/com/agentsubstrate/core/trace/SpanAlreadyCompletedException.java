package com.agentsubstrate.core.trace;

/**
 * Thrown when a span that already reached a terminal state is transitioned again.
 */
public class SpanAlreadyCompletedException extends RuntimeException {

    public SpanAlreadyCompletedException(String message) {
        super(message);
    }
}

package com.agentsubstrate.core.trace;

public class SpanNotFoundException extends RuntimeException {

    public SpanNotFoundException(String message) {
        super(message);
    }
}

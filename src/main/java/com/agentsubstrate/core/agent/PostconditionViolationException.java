package com.agentsubstrate.core.agent;

/**
 * Thrown when an agent's output breaks a runtime postcondition.
 */
public class PostconditionViolationException extends RuntimeException {

    public PostconditionViolationException(String message) {
        super(message);
    }
}

package com.agentsubstrate.core.persistence;

/**
 * Thrown when the decision event ledger cannot be reached or rejects a request.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

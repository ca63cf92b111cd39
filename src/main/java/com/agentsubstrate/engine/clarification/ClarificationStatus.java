package com.agentsubstrate.engine.clarification;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall verdict on an objective.
 */
public enum ClarificationStatus {
    CLEAR("clear"),
    NEEDS_CLARIFICATION("needs_clarification"),
    REQUIRES_DECOMPOSITION("requires_decomposition"),
    INSUFFICIENT("insufficient");

    private final String value;

    ClarificationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

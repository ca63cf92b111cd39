package com.agentsubstrate.engine.metareasoning;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ContradictionType {
    DIRECT("direct"),
    IMPLICIT("implicit"),
    TEMPORAL("temporal"),
    CONTEXTUAL("contextual"),
    STATISTICAL("statistical");

    private final String value;

    ContradictionType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

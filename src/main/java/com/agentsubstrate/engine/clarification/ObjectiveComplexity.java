package com.agentsubstrate.engine.clarification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ObjectiveComplexity {
    SIMPLE("simple"),
    MODERATE("moderate"),
    COMPLEX("complex"),
    VERY_COMPLEX("very_complex");

    private final String value;

    ObjectiveComplexity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

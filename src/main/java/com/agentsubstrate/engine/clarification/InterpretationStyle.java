package com.agentsubstrate.engine.clarification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InterpretationStyle {
    CONSERVATIVE("conservative"),
    BALANCED("balanced"),
    LIBERAL("liberal");

    private final String value;

    InterpretationStyle(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

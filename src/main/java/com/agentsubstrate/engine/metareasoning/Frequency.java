package com.agentsubstrate.engine.metareasoning;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Frequency {
    ISOLATED("isolated"),
    OCCASIONAL("occasional"),
    FREQUENT("frequent"),
    PERVASIVE("pervasive");

    private final String value;

    Frequency(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

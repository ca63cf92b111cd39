package com.agentsubstrate.engine.decomposition;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Granularity {
    COARSE("coarse"),
    MEDIUM("medium"),
    FINE("fine");

    private final String value;

    Granularity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

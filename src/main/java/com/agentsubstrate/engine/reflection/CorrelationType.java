package com.agentsubstrate.engine.reflection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CorrelationType {
    CAUSAL("causal"),
    TEMPORAL("temporal"),
    SIMILARITY("similarity"),
    DEPENDENCY("dependency");

    private final String value;

    CorrelationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

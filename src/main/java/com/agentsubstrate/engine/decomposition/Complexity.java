package com.agentsubstrate.engine.decomposition;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Complexity {
    TRIVIAL("trivial"),
    SIMPLE("simple"),
    MODERATE("moderate"),
    COMPLEX("complex"),
    VERY_COMPLEX("very_complex");

    private final String value;

    Complexity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

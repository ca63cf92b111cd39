package com.agentsubstrate.engine.reflection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QualitySignalType {
    PERFORMANCE("performance"),
    ACCURACY("accuracy"),
    COMPLETENESS("completeness"),
    CONSISTENCY("consistency"),
    EFFICIENCY("efficiency"),
    RELIABILITY("reliability");

    private final String value;

    QualitySignalType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

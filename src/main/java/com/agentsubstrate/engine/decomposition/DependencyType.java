package com.agentsubstrate.engine.decomposition;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a sub-objective relies on another.
 */
public enum DependencyType {
    BLOCKING("blocking"),
    DATA("data"),
    SEQUENTIAL("sequential");

    private final String value;

    DependencyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

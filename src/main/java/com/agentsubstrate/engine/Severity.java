package com.agentsubstrate.engine;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity shared by findings of the analytical engines.
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

package com.agentsubstrate.engine.reflection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalSeverity {
    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical");

    private final String value;

    SignalSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

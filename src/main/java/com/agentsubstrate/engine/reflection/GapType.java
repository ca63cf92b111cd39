package com.agentsubstrate.engine.reflection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GapType {
    COVERAGE("coverage"),
    CAPABILITY("capability"),
    DATA("data"),
    PROCESS("process"),
    INTEGRATION("integration"),
    DOCUMENTATION("documentation");

    private final String value;

    GapType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

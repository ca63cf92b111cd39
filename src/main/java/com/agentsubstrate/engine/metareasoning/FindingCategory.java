package com.agentsubstrate.engine.metareasoning;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FindingCategory {
    CONTRADICTION("contradiction"),
    CALIBRATION("calibration"),
    SYSTEMIC("systemic"),
    QUALITY("quality");

    private final String value;

    FindingCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

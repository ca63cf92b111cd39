package com.agentsubstrate.engine.metareasoning;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CalibrationAssessment {
    WELL_CALIBRATED("well_calibrated"),
    OVERCONFIDENT("overconfident"),
    UNDERCONFIDENT("underconfident"),
    INCONSISTENT("inconsistent"),
    INSUFFICIENT_DATA("insufficient_data");

    private final String value;

    CalibrationAssessment(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

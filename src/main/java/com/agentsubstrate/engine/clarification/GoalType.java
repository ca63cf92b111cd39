package com.agentsubstrate.engine.clarification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GoalType {
    FUNCTIONAL("functional"),
    NON_FUNCTIONAL("non_functional"),
    CONSTRAINT("constraint"),
    ASSUMPTION("assumption");

    private final String value;

    GoalType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

package com.agentsubstrate.engine.clarification;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of constraint an objective is expected to state.
 */
public enum ConstraintCategory {
    TEMPORAL("temporal"),
    RESOURCE("resource"),
    QUALITY("quality"),
    SCOPE("scope"),
    DEPENDENCY("dependency"),
    COMPLIANCE("compliance"),
    TECHNICAL("technical"),
    PERFORMANCE("performance");

    private final String value;

    ConstraintCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

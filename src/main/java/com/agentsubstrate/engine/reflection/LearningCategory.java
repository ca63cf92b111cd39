package com.agentsubstrate.engine.reflection;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LearningCategory {
    PATTERN("pattern"),
    ANTI_PATTERN("anti_pattern"),
    OPTIMIZATION("optimization"),
    EDGE_CASE("edge_case"),
    DEPENDENCY("dependency"),
    CONSTRAINT("constraint");

    private final String value;

    LearningCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

package com.agentsubstrate.engine.clarification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AmbiguityType {
    LEXICAL("lexical"),
    SYNTACTIC("syntactic"),
    SEMANTIC("semantic"),
    REFERENTIAL("referential"),
    SCOPE("scope"),
    TEMPORAL("temporal"),
    QUANTITATIVE("quantitative"),
    CONDITIONAL("conditional");

    private final String value;

    AmbiguityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

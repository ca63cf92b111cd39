package com.agentsubstrate.engine.metareasoning;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reasoning failure modes that recur across traces.
 */
public enum SystemicIssueType {
    REASONING_GAP("reasoning_gap"),
    CIRCULAR_REASONING("circular_reasoning"),
    ANCHORING_BIAS("anchoring_bias"),
    CONFIRMATION_BIAS("confirmation_bias"),
    AVAILABILITY_BIAS("availability_bias"),
    PATTERN_OVERFITTING("pattern_overfitting"),
    SCOPE_CREEP("scope_creep"),
    PREMATURE_CONCLUSION("premature_conclusion"),
    INCONSISTENT_CRITERIA("inconsistent_criteria"),
    MISSING_UNCERTAINTY("missing_uncertainty");

    private final String value;

    SystemicIssueType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}

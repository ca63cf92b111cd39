package com.agentsubstrate.core.trace;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Span lifecycle. {@code RUNNING} moves one way to a terminal state.
 */
public enum SpanStatus {
    @JsonProperty("running") RUNNING,
    @JsonProperty("completed") COMPLETED,
    @JsonProperty("failed") FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}

package com.agentsubstrate.core.trace;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum SpanType {
    @JsonProperty("core") CORE,
    @JsonProperty("repo") REPO,
    @JsonProperty("agent") AGENT
}

package com.agentsubstrate.core.telemetry;

import com.agentsubstrate.core.contract.ErrorCode;

/**
 * Used when {@code substrate.telemetry.enabled=false}.
 */
public class NoopAgentTelemetry implements AgentTelemetry {

    @Override
    public void recordStart(String agentId, String executionRef, Object input) {
    }

    @Override
    public void recordSuccess(String agentId, String executionRef, long durationMs) {
    }

    @Override
    public void recordFailure(String agentId, String executionRef, ErrorCode errorCode, String errorMessage) {
    }
}

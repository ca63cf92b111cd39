package com.agentsubstrate.core.telemetry;

import com.agentsubstrate.core.contract.ErrorCode;

/**
 * Fire-and-forget telemetry for agent invocations.
 * <p>
 * Implementations must never throw: failures are logged and swallowed so that
 * telemetry cannot affect an invocation's result.
 */
public interface AgentTelemetry {

    void recordStart(String agentId, String executionRef, Object input);

    void recordSuccess(String agentId, String executionRef, long durationMs);

    void recordFailure(String agentId, String executionRef, ErrorCode errorCode, String errorMessage);
}

package com.agentsubstrate.core.telemetry;

import com.agentsubstrate.core.contract.DecisionEvents;
import com.agentsubstrate.core.contract.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Agent invocation telemetry on Micrometer.
 * <p>
 * Meters: {@code agent.invocation.started}, {@code agent.invocation.duration} and
 * {@code agent.invocation.count}, all tagged with {@code agent_id}; the latter two also carry
 * {@code status}. Each invocation is logged as span {@code agent.<id>.invoke}.
 */
public class MicrometerAgentTelemetry implements AgentTelemetry {

    private static final Logger log = LoggerFactory.getLogger(MicrometerAgentTelemetry.class);

    static final int MAX_ERROR_MESSAGE_LENGTH = 256;

    private final MeterRegistry registry;

    public MicrometerAgentTelemetry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordStart(String agentId, String executionRef, Object input) {
        try {
            log.debug("span agent.{}.invoke started (execution_ref={}, input_hash={})",
                    agentId, executionRef, DecisionEvents.hashInputs(input));
            Counter.builder("agent.invocation.started")
                    .tag("agent_id", agentId)
                    .register(registry)
                    .increment();
        } catch (Exception e) {
            log.warn("Telemetry recordStart failed for {}: {}", agentId, e.getMessage(), e);
        }
    }

    @Override
    public void recordSuccess(String agentId, String executionRef, long durationMs) {
        try {
            Timer.builder("agent.invocation.duration")
                    .tag("agent_id", agentId)
                    .tag("status", "success")
                    .register(registry)
                    .record(Duration.ofMillis(durationMs));
            Counter.builder("agent.invocation.count")
                    .tag("agent_id", agentId)
                    .tag("status", "success")
                    .register(registry)
                    .increment();
            log.debug("span agent.{}.invoke ok in {}ms (execution_ref={})", agentId, durationMs, executionRef);
        } catch (Exception e) {
            log.warn("Telemetry recordSuccess failed for {}: {}", agentId, e.getMessage(), e);
        }
    }

    @Override
    public void recordFailure(String agentId, String executionRef, ErrorCode errorCode, String errorMessage) {
        try {
            Counter.builder("agent.invocation.count")
                    .tag("agent_id", agentId)
                    .tag("status", "failure")
                    .tag("error_code", errorCode.name())
                    .register(registry)
                    .increment();
            log.debug("span agent.{}.invoke failed (execution_ref={}, error_code={}): {}",
                    agentId, executionRef, errorCode, truncate(errorMessage));
        } catch (Exception e) {
            log.warn("Telemetry recordFailure failed for {}: {}", agentId, e.getMessage(), e);
        }
    }

    static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= MAX_ERROR_MESSAGE_LENGTH ? message : message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}

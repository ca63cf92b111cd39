package com.agentsubstrate.core.agent;

import java.util.List;

/**
 * A stateless analytical agent. Implementations are pure: {@link #analyze} performs no I/O and,
 * apart from fresh identifiers, returns the same output for the same input.
 * <p>
 * Agents are invoked only through {@link AgentInvoker}, which handles validation, the decision
 * event, persistence and telemetry. Agents never call one another.
 *
 * @param <I> validated input type
 * @param <O> output type, itself subject to Bean Validation
 */
public interface AnalyticalAgent<I, O> {

    AgentMetadata metadata();

    Class<I> inputType();

    O analyze(I input);

    /**
     * Heuristic confidence in the output. The runtime clamps the value to [0, 1].
     */
    double confidence(I input, O output);

    List<String> constraintsApplied(I input, O output);
}

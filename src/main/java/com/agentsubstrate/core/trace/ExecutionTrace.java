package com.agentsubstrate.core.trace;

import java.util.List;

/**
 * Serializable snapshot of an {@link ExecutionGraph}, as handed to the trace collector.
 */
public record ExecutionTrace(String executionId, String repoSpanId, List<ExecutionSpan> spans) {

    public ExecutionTrace {
        spans = List.copyOf(spans);
    }
}

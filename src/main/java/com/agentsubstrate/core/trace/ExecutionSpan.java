package com.agentsubstrate.core.trace;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of a request's execution trace. Values are immutable; the owning
 * {@link ExecutionGraph} swaps in a new instance on every transition.
 */
public record ExecutionSpan(
        String spanId,
        String parentSpanId,
        String traceId,
        SpanType spanType,
        String repoName,
        String agentName,
        SpanStatus status,
        Instant startTime,
        Instant endTime,
        String failureReason,
        List<SpanArtifact> artifacts,
        Map<String, String> attributes
) {

    public ExecutionSpan {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    static ExecutionSpan running(String spanId, String parentSpanId, String traceId, SpanType type,
                                 String repoName, String agentName, Instant start) {
        return new ExecutionSpan(spanId, parentSpanId, traceId, type, repoName, agentName,
                SpanStatus.RUNNING, start, null, null, List.of(), Map.of());
    }

    ExecutionSpan completed(Instant end, List<SpanArtifact> producedArtifacts) {
        return new ExecutionSpan(spanId, parentSpanId, traceId, spanType, repoName, agentName,
                SpanStatus.COMPLETED, startTime, end, null, producedArtifacts, attributes);
    }

    ExecutionSpan failed(Instant end, String reason) {
        return new ExecutionSpan(spanId, parentSpanId, traceId, spanType, repoName, agentName,
                SpanStatus.FAILED, startTime, end, reason, artifacts, attributes);
    }

    ExecutionSpan withAttribute(String key, String value) {
        Map<String, String> updated = new LinkedHashMap<>(attributes);
        updated.put(key, value);
        return new ExecutionSpan(spanId, parentSpanId, traceId, spanType, repoName, agentName,
                status, startTime, endTime, failureReason, artifacts, updated);
    }
}

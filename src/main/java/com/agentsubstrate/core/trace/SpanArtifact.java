package com.agentsubstrate.core.trace;

/**
 * Something a span produced, attached when the span completes.
 *
 * @param name         artifact name, e.g. {@code decision_event}
 * @param artifactType artifact kind
 * @param reference    external id the artifact can be looked up by (usually the execution ref)
 * @param data         inline payload, may be null
 */
public record SpanArtifact(String name, String artifactType, String reference, Object data) {
}

package com.agentsubstrate.core.trace;

import com.agentsubstrate.core.json.AgentJson;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Span bookkeeping for one request: a single {@code repo} span anchored under the caller's
 * span, with one {@code agent} span per analytical invocation beneath it.
 * <p>
 * Owned by the request that created it and not thread-safe. A repo may only complete once
 * at least one agent span exists; that rule is enforced by {@link #validate()}.
 */
public class ExecutionGraph {

    private static final Logger log = LoggerFactory.getLogger(ExecutionGraph.class);

    public static final String REPO_NAME = "agent-substrate";

    private final String executionId;
    private final String traceId;
    private final String repoSpanId;
    private final Clock clock;
    private final List<ExecutionSpan> spans = new ArrayList<>();

    public ExecutionGraph(String executionId, String parentSpanId, String traceId) {
        this(executionId, parentSpanId, traceId, Clock.systemUTC());
    }

    ExecutionGraph(String executionId, String parentSpanId, String traceId, Clock clock) {
        if (parentSpanId == null || parentSpanId.isBlank()) {
            throw new MissingParentSpanException(
                    "Missing parent_span_id: execution context requires a parent span from the caller");
        }
        this.executionId = executionId;
        this.traceId = traceId != null && !traceId.isBlank() ? traceId : newSpanId() + newSpanId();
        this.clock = clock;
        this.repoSpanId = newSpanId();
        spans.add(ExecutionSpan.running(repoSpanId, parentSpanId, this.traceId, SpanType.REPO,
                REPO_NAME, null, clock.instant()));
        log.debug("Opened repo span {} under parent {} (execution {})", repoSpanId, parentSpanId, executionId);
    }

    /**
     * Opens an agent span as a child of the repo span.
     *
     * @return the new span's id
     */
    public String startAgentSpan(String agentName) {
        ExecutionSpan repo = find(repoSpanId);
        if (repo.status().isTerminal()) {
            throw new SpanAlreadyCompletedException("Span already completed: " + repoSpanId);
        }
        String spanId = newSpanId();
        spans.add(ExecutionSpan.running(spanId, repoSpanId, traceId, SpanType.AGENT,
                REPO_NAME, agentName, clock.instant()));
        log.debug("Started agent span {} for {}", spanId, agentName);
        return spanId;
    }

    /**
     * @throws SpanNotFoundException when {@code spanId} is not an agent span of this graph
     */
    public void completeAgentSpan(String spanId, List<SpanArtifact> artifacts) {
        ExecutionSpan span = requireRunningAgent(spanId);
        replace(span.completed(clock.instant(), artifacts));
    }

    /**
     * @throws SpanNotFoundException when {@code spanId} is not an agent span of this graph
     */
    public void failAgentSpan(String spanId, String reason) {
        ExecutionSpan span = requireRunningAgent(spanId);
        replace(span.failed(clock.instant(), reason));
    }

    public void setRepoAttribute(String key, String value) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Repo attribute key and value must not be null (key: " + key + ")");
        }
        replace(find(repoSpanId).withAttribute(key, value));
    }

    public boolean hasAgentSpans() {
        return spans.stream().anyMatch(s -> s.spanType() == SpanType.AGENT);
    }

    /**
     * Checks that the graph can be completed.
     *
     * @throws InvalidExecutionException when no agent span has been recorded
     */
    public void validate() {
        if (!hasAgentSpans()) {
            throw new InvalidExecutionException(
                    "No agent-level spans emitted: execution is INVALID without agent spans");
        }
    }

    public void completeRepo() {
        validate();
        ExecutionSpan repo = requireRunning(repoSpanId);
        replace(repo.completed(clock.instant(), repo.artifacts()));
        log.debug("Completed repo span {} with {} span(s)", repoSpanId, spans.size());
    }

    public void failRepo(String reason) {
        ExecutionSpan repo = requireRunning(repoSpanId);
        replace(repo.failed(clock.instant(), reason));
        log.debug("Failed repo span {}: {}", repoSpanId, reason);
    }

    public String executionId() {
        return executionId;
    }

    public String traceId() {
        return traceId;
    }

    public String repoSpanId() {
        return repoSpanId;
    }

    public ExecutionSpan span(String spanId) {
        return find(spanId);
    }

    public List<ExecutionSpan> spans() {
        return List.copyOf(spans);
    }

    public ExecutionTrace toTrace() {
        return new ExecutionTrace(executionId, repoSpanId, spans);
    }

    public JsonNode toJson() {
        return AgentJson.toTree(toTrace());
    }

    // the repo span closes only through completeRepo or failRepo
    private ExecutionSpan requireRunningAgent(String spanId) {
        ExecutionSpan span = find(spanId);
        if (span.spanType() != SpanType.AGENT) {
            throw new SpanNotFoundException("Not an agent span: " + spanId);
        }
        return requireRunning(spanId);
    }

    private ExecutionSpan requireRunning(String spanId) {
        ExecutionSpan span = find(spanId);
        if (span.status().isTerminal()) {
            throw new SpanAlreadyCompletedException("Span already completed: " + spanId);
        }
        return span;
    }

    private ExecutionSpan find(String spanId) {
        return spans.stream()
                .filter(s -> s.spanId().equals(spanId))
                .findFirst()
                .orElseThrow(() -> new SpanNotFoundException("Span not found: " + spanId));
    }

    private void replace(ExecutionSpan updated) {
        for (int i = 0; i < spans.size(); i++) {
            if (spans.get(i).spanId().equals(updated.spanId())) {
                spans.set(i, updated);
                return;
            }
        }
        throw new SpanNotFoundException("Span not found: " + updated.spanId());
    }

    private static String newSpanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}

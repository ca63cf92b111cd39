package com.agentsubstrate.core.trace;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionGraphTest {

    private static final String PARENT = "caller-span-01";

    private ExecutionGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ExecutionGraph("exec-1", PARENT, "trace-1",
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    // -- Construction ----------------------------------------------------------

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("opens a running repo span under the caller's span")
        void repoSpan() {
            ExecutionSpan repo = graph.span(graph.repoSpanId());
            assertEquals(SpanType.REPO, repo.spanType());
            assertEquals(SpanStatus.RUNNING, repo.status());
            assertEquals(PARENT, repo.parentSpanId());
            assertEquals("trace-1", repo.traceId());
            assertEquals(ExecutionGraph.REPO_NAME, repo.repoName());
            assertEquals(16, repo.spanId().length());
        }

        @Test
        @DisplayName("requires a parent span id")
        void missingParent() {
            assertThrows(MissingParentSpanException.class, () -> new ExecutionGraph("exec-1", null, null));
            assertThrows(MissingParentSpanException.class, () -> new ExecutionGraph("exec-1", " ", null));
        }

        @Test
        @DisplayName("generates a trace id when none is supplied")
        void generatedTraceId() {
            var g = new ExecutionGraph("exec-2", PARENT, null);
            assertEquals(32, g.traceId().length());
        }
    }

    // -- Agent spans -----------------------------------------------------------

    @Nested
    @DisplayName("agent spans")
    class AgentSpans {

        @Test
        @DisplayName("are children of the repo span")
        void childOfRepo() {
            String spanId = graph.startAgentSpan("decomposer-agent");
            ExecutionSpan span = graph.span(spanId);
            assertEquals(graph.repoSpanId(), span.parentSpanId());
            assertEquals(SpanType.AGENT, span.spanType());
            assertEquals("decomposer-agent", span.agentName());
            assertTrue(graph.hasAgentSpans());
        }

        @Test
        @DisplayName("complete with their artifacts")
        void complete() {
            String spanId = graph.startAgentSpan("a");
            graph.completeAgentSpan(spanId, List.of(new SpanArtifact("decision_event", "decision_event", "ref", null)));
            ExecutionSpan span = graph.span(spanId);
            assertEquals(SpanStatus.COMPLETED, span.status());
            assertNotNull(span.endTime());
            assertEquals("decision_event", span.artifacts().get(0).name());
        }

        @Test
        @DisplayName("fail with a reason")
        void fail() {
            String spanId = graph.startAgentSpan("a");
            graph.failAgentSpan(spanId, "boom");
            assertEquals(SpanStatus.FAILED, graph.span(spanId).status());
            assertEquals("boom", graph.span(spanId).failureReason());
        }

        @Test
        @DisplayName("cannot be closed twice")
        void closedOnce() {
            String spanId = graph.startAgentSpan("a");
            graph.completeAgentSpan(spanId, List.of());
            assertThrows(SpanAlreadyCompletedException.class, () -> graph.completeAgentSpan(spanId, List.of()));
            assertThrows(SpanAlreadyCompletedException.class, () -> graph.failAgentSpan(spanId, "late"));
        }

        @Test
        @DisplayName("unknown span ids are rejected")
        void unknownSpan() {
            assertThrows(SpanNotFoundException.class, () -> graph.completeAgentSpan("nope", List.of()));
        }

        @Test
        @DisplayName("the repo span cannot be closed as an agent span")
        void repoSpanIsNotAnAgentSpan() {
            String repoSpanId = graph.repoSpanId();
            assertThrows(SpanNotFoundException.class, () -> graph.completeAgentSpan(repoSpanId, List.of()));
            assertThrows(SpanNotFoundException.class, () -> graph.failAgentSpan(repoSpanId, "boom"));
            assertEquals(SpanStatus.RUNNING, graph.span(repoSpanId).status());
            assertFalse(graph.hasAgentSpans());
            assertThrows(InvalidExecutionException.class, graph::completeRepo);
        }

        @Test
        @DisplayName("cannot start once the repo span is closed")
        void afterRepoClosed() {
            graph.failRepo("aborted");
            assertThrows(SpanAlreadyCompletedException.class, () -> graph.startAgentSpan("a"));
        }
    }

    // -- Repo completion -------------------------------------------------------

    @Nested
    @DisplayName("repo completion")
    class RepoCompletion {

        @Test
        @DisplayName("is invalid without agent spans")
        void requiresAgentSpan() {
            assertThrows(InvalidExecutionException.class, graph::completeRepo);
            assertEquals(SpanStatus.RUNNING, graph.span(graph.repoSpanId()).status());
        }

        @Test
        @DisplayName("succeeds once an agent span exists, even a failed one")
        void completesWithAgentSpan() {
            String spanId = graph.startAgentSpan("a");
            graph.failAgentSpan(spanId, "boom");
            graph.completeRepo();
            assertEquals(SpanStatus.COMPLETED, graph.span(graph.repoSpanId()).status());
        }

        @Test
        @DisplayName("failRepo closes the repo span without agent spans")
        void failRepo() {
            graph.failRepo("no work");
            assertEquals(SpanStatus.FAILED, graph.span(graph.repoSpanId()).status());
        }

        @Test
        @DisplayName("repo attributes are kept on the repo span")
        void attributes() {
            graph.setRepoAttribute("objective_length", "42");
            assertEquals("42", graph.span(graph.repoSpanId()).attributes().get("objective_length"));
        }

        @Test
        @DisplayName("null repo attribute keys and values are rejected")
        void nullAttributes() {
            var e = assertThrows(IllegalArgumentException.class, () -> graph.setRepoAttribute("objective_length", null));
            assertTrue(e.getMessage().contains("objective_length"));
            assertThrows(IllegalArgumentException.class, () -> graph.setRepoAttribute(null, "42"));
            assertTrue(graph.span(graph.repoSpanId()).attributes().isEmpty());
        }
    }

    @Test
    @DisplayName("toJson lists every span with snake_case keys")
    void json() {
        graph.startAgentSpan("a");
        JsonNode json = graph.toJson();
        assertEquals("exec-1", json.get("execution_id").asText());
        assertEquals(2, json.get("spans").size());
        assertEquals("repo", json.get("spans").get(0).get("span_type").asText());
        assertEquals("running", json.get("spans").get(1).get("status").asText());
    }

    @Test
    @DisplayName("spans() is an immutable snapshot")
    void snapshot() {
        List<ExecutionSpan> before = graph.spans();
        graph.startAgentSpan("a");
        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(before.get(0)));
    }
}

package com.agentsubstrate.core.agent;

import com.agentsubstrate.core.contract.AgentResult;
import com.agentsubstrate.core.json.AgentJson;
import com.agentsubstrate.core.persistence.InMemoryDecisionEventStore;
import com.agentsubstrate.core.telemetry.NoopAgentTelemetry;
import com.agentsubstrate.core.trace.ExecutionGraph;
import com.agentsubstrate.core.trace.ExecutionSpan;
import com.agentsubstrate.core.trace.SpanStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentSpanRunnerTest {

    private static final String REF = "3f2b8c1e-9d4a-4e6b-8f7c-1a2b3c4d5e6f";

    private AgentSpanRunner runner;
    private ExecutionGraph graph;

    @BeforeEach
    void setUp() {
        var invoker = new AgentInvoker(new InMemoryDecisionEventStore(), new NoopAgentTelemetry(),
                Runnable::run, Duration.ofSeconds(5));
        runner = new AgentSpanRunner(invoker);
        graph = new ExecutionGraph(REF, "caller-span", null);
    }

    @Test
    @DisplayName("a successful invocation completes its agent span with the decision event artifact")
    void completesSpan() throws Exception {
        AgentResult result = runner.withAgentSpan(new StubAgent(),
                AgentJson.mapper().readTree("{\"text\":\"x\"}"), REF, graph);

        assertTrue(result.succeeded());
        ExecutionSpan span = graph.spans().get(1);
        assertEquals(SpanStatus.COMPLETED, span.status());
        assertEquals("stub-agent", span.agentName());
        assertEquals(AgentSpanRunner.DECISION_EVENT_ARTIFACT, span.artifacts().get(0).name());
        assertEquals(REF, span.artifacts().get(0).reference());

        graph.completeRepo();
        assertEquals(SpanStatus.COMPLETED, graph.span(graph.repoSpanId()).status());
    }

    @Test
    @DisplayName("an error result fails the agent span with the error message")
    void failsSpan() throws Exception {
        AgentResult result = runner.withAgentSpan(new StubAgent(),
                AgentJson.mapper().readTree("{\"text\":\"\"}"), REF, graph);

        var failure = assertInstanceOf(AgentResult.Failure.class, result);
        ExecutionSpan span = graph.spans().get(1);
        assertEquals(SpanStatus.FAILED, span.status());
        assertEquals(failure.errorMessage(), span.failureReason());
    }

    @Test
    @DisplayName("an exception escaping the invoker fails the span and is rethrown")
    void rethrows() {
        AgentInvoker invoker = mock(AgentInvoker.class);
        when(invoker.invoke(any(), any(), any())).thenThrow(new IllegalStateException("invoker broke"));
        var failingRunner = new AgentSpanRunner(invoker);

        var e = assertThrows(IllegalStateException.class,
                () -> failingRunner.withAgentSpan(new StubAgent(), null, REF, graph));
        assertEquals("invoker broke", e.getMessage());
        assertEquals(SpanStatus.FAILED, graph.spans().get(1).status());
    }
}

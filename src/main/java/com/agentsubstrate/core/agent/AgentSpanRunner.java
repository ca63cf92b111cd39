package com.agentsubstrate.core.agent;

import com.agentsubstrate.core.contract.AgentResult;
import com.agentsubstrate.core.logging.MdcContext;
import com.agentsubstrate.core.trace.ExecutionGraph;
import com.agentsubstrate.core.trace.SpanArtifact;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Records an agent invocation as an agent span of an {@link ExecutionGraph}.
 */
@Component
public class AgentSpanRunner {

    static final String DECISION_EVENT_ARTIFACT = "decision_event";

    private final AgentInvoker invoker;

    public AgentSpanRunner(AgentInvoker invoker) {
        this.invoker = invoker;
    }

    /**
     * Opens an agent span, invokes the agent and closes the span: completed with the decision
     * event as artifact on success, failed with the error message otherwise. An exception thrown
     * by the invocation fails the span and is rethrown.
     */
    public AgentResult withAgentSpan(AnalyticalAgent<?, ?> agent, JsonNode input, String executionRef,
                                     ExecutionGraph graph) {
        String spanId = graph.startAgentSpan(agent.metadata().id());
        MdcContext.setSpan(spanId);
        try {
            AgentResult result = invoker.invoke(agent, input, executionRef);
            if (result instanceof AgentResult.Success success) {
                graph.completeAgentSpan(spanId, List.of(new SpanArtifact(
                        DECISION_EVENT_ARTIFACT, DECISION_EVENT_ARTIFACT,
                        success.event().executionRef(), success.event())));
            } else if (result instanceof AgentResult.Failure failure) {
                graph.failAgentSpan(spanId, failure.errorMessage());
            }
            return result;
        } catch (RuntimeException e) {
            graph.failAgentSpan(spanId, e.getMessage());
            throw e;
        } finally {
            MdcContext.clearSpan();
        }
    }
}

package com.agentsubstrate.dispatch.cli;

import com.agentsubstrate.core.agent.AgentInvoker;
import com.agentsubstrate.core.agent.AnalyticalAgent;
import com.agentsubstrate.engine.reflection.ReflectionAgent;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: substrate reflect --input '{"decision_events": [...]}'
 */
@Command(name = "reflect", mixinStandardHelpOptions = true,
        description = "Extract quality and learning signals from past decision events")
@Component
public class ReflectCommand extends AgentCommand {

    private final ReflectionAgent agent;

    public ReflectCommand(AgentInvoker invoker, ReflectionAgent agent) {
        super(invoker);
        this.agent = agent;
    }

    @Override
    protected AnalyticalAgent<?, ?> agent() {
        return agent;
    }

    @Override
    protected String describe(JsonNode outputs) {
        JsonNode summary = outputs.path("summary");
        return "%d events, overall quality %s, %d quality signals, %d learning signals, %d gaps".formatted(
                outputs.path("events_analyzed").asInt(),
                summary.path("overall_quality_score").asText(),
                summary.path("total_quality_signals").asInt(),
                summary.path("total_learning_signals").asInt(),
                summary.path("total_gaps").asInt());
    }
}

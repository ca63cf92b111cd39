package com.agentsubstrate.dispatch.cli;

import com.agentsubstrate.core.agent.AgentInvoker;
import com.agentsubstrate.core.agent.AnalyticalAgent;
import com.agentsubstrate.engine.metareasoning.MetaReasonerAgent;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: substrate meta-reason --input '{"traces": [...]}'
 */
@Command(name = "meta-reason", mixinStandardHelpOptions = true,
        description = "Assess reasoning quality across agent traces")
@Component
public class MetaReasonCommand extends AgentCommand {

    private final MetaReasonerAgent agent;

    public MetaReasonCommand(AgentInvoker invoker, MetaReasonerAgent agent) {
        super(invoker);
        this.agent = agent;
    }

    @Override
    protected AnalyticalAgent<?, ?> agent() {
        return agent;
    }

    @Override
    protected String describe(JsonNode outputs) {
        return "overall score %s, %d contradictions, %d systemic issues".formatted(
                outputs.path("quality_metrics").path("overall_score").asText(),
                outputs.path("contradictions").size(),
                outputs.path("systemic_issues").size());
    }
}

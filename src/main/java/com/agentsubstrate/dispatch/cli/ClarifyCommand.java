package com.agentsubstrate.dispatch.cli;

import com.agentsubstrate.core.agent.AgentInvoker;
import com.agentsubstrate.core.agent.AnalyticalAgent;
import com.agentsubstrate.core.json.AgentJson;
import com.agentsubstrate.engine.clarification.ObjectiveClarifierAgent;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: substrate clarify -o "&lt;objective&gt;"
 */
@Command(name = "clarify", mixinStandardHelpOptions = true,
        description = "Find ambiguities and missing constraints in an objective")
@Component
public class ClarifyCommand extends AgentCommand {

    @Option(names = {"--objective", "-o"}, description = "Objective to clarify")
    private String objective;

    private final ObjectiveClarifierAgent agent;

    public ClarifyCommand(AgentInvoker invoker, ObjectiveClarifierAgent agent) {
        super(invoker);
        this.agent = agent;
    }

    @Override
    protected AnalyticalAgent<?, ?> agent() {
        return agent;
    }

    @Override
    protected boolean supportsObjective() {
        return true;
    }

    @Override
    protected JsonNode shortcutInput() {
        return objective == null ? null : AgentJson.mapper().createObjectNode().put("objective", objective);
    }

    @Override
    protected String describe(JsonNode outputs) {
        return "status %s, %d ambiguities, %d missing constraints, %d questions".formatted(
                outputs.path("status").asText(),
                outputs.path("ambiguities").size(),
                outputs.path("missing_constraints").size(),
                outputs.path("clarification_questions").size());
    }
}

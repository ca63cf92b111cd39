package com.agentsubstrate.dispatch.cli;

import com.agentsubstrate.core.agent.AgentInvoker;
import com.agentsubstrate.core.agent.AnalyticalAgent;
import com.agentsubstrate.core.json.AgentJson;
import com.agentsubstrate.engine.decomposition.DecomposerAgent;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: substrate decompose -o "&lt;objective&gt;"
 */
@Command(name = "decompose", mixinStandardHelpOptions = true,
        description = "Decompose an objective into sub-objectives and a pipeline spec")
@Component
public class DecomposeCommand extends AgentCommand {

    @Option(names = {"--objective", "-o"}, description = "Objective to decompose")
    private String objective;

    private final DecomposerAgent agent;

    public DecomposeCommand(AgentInvoker invoker, DecomposerAgent agent) {
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
        return "%d sub-objectives, %d pipeline steps".formatted(
                outputs.path("sub_objectives").size(),
                outputs.path("pipeline_spec").path("steps").size());
    }
}

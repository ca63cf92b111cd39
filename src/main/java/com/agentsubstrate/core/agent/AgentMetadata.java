package com.agentsubstrate.core.agent;

import java.util.List;

/**
 * Static identity of an analytical agent.
 *
 * @param id              stable agent id written into every decision event
 * @param name            display name
 * @param version         semantic version written into every decision event
 * @param classifications kinds of analysis performed
 * @param decisionType    decision type written into every decision event
 * @param description     one-line description for help output
 */
public record AgentMetadata(
        String id,
        String name,
        String version,
        List<AgentClassification> classifications,
        String decisionType,
        String description
) {

    public AgentMetadata {
        classifications = List.copyOf(classifications);
    }
}

package com.agentsubstrate.engine.decomposition;

import java.util.List;

/**
 * Routes objectives mentioning any of {@code keywords} to {@code domain/agent}.
 */
public record DomainRoute(
        String domain,
        String agent,
        List<String> keywords,
        String description,
        String outputSchema
) {

    public DomainRoute {
        keywords = List.copyOf(keywords);
    }

    public String key() {
        return domain + "/" + agent;
    }

    /**
     * Substring match against an already lower-cased objective.
     */
    public boolean matches(String lowerObjective) {
        return keywords.stream().anyMatch(lowerObjective::contains);
    }
}

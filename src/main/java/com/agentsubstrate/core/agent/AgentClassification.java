package com.agentsubstrate.core.agent;

/**
 * What kind of analysis an agent performs. Informational; carried in {@link AgentMetadata}.
 */
public enum AgentClassification {
    DECOMPOSITION,
    STRUCTURAL_SYNTHESIS,
    META_ANALYSIS,
    REASONING_QUALITY_ASSESSMENT,
    INTENT_ANALYSIS,
    AMBIGUITY_DETECTION,
    POST_EXECUTION_ANALYSIS,
    QUALITY_ASSESSMENT,
    LEARNING_SIGNAL_EXTRACTION
}

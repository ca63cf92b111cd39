package com.agentsubstrate.core.contract;

public enum ErrorCode {
    AGENT_INVALID_INPUT,
    AGENT_VALIDATION_FAILED,
    AGENT_PROCESSING_ERROR,
    AGENT_PERSISTENCE_ERROR,
    AGENT_TIMEOUT,
    AGENT_UNKNOWN_ERROR
}

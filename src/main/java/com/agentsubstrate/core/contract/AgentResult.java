package com.agentsubstrate.core.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Tagged result of one agent invocation: either a decision event with its persistence
 * outcome, or an error with no event.
 */
public sealed interface AgentResult permits AgentResult.Success, AgentResult.Failure {

    String STATUS_SUCCESS = "success";
    String STATUS_ERROR = "error";

    @JsonProperty("status")
    String status();

    String executionRef();

    default boolean succeeded() {
        return this instanceof Success;
    }

    @JsonPropertyOrder({"status", "event", "persistence_status"})
    record Success(DecisionEvent event, PersistenceStatus persistenceStatus) implements AgentResult {

        @Override
        @JsonProperty("status")
        public String status() {
            return STATUS_SUCCESS;
        }

        @Override
        public String executionRef() {
            return event.executionRef();
        }
    }

    @JsonPropertyOrder({"status", "error_code", "error_message", "execution_ref", "timestamp"})
    record Failure(ErrorCode errorCode, String errorMessage, String executionRef, Instant timestamp)
            implements AgentResult {

        @Override
        @JsonProperty("status")
        public String status() {
            return STATUS_ERROR;
        }
    }
}

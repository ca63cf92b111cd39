package com.agentsubstrate.core.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of the best-effort ledger write attached to a successful invocation.
 *
 * @param status {@code persisted} or {@code skipped}
 * @param error  why the write was skipped, absent when persisted
 */
public record PersistenceStatus(Status status, String error) {

    public enum Status {
        @JsonProperty("persisted") PERSISTED,
        @JsonProperty("skipped") SKIPPED
    }

    public static PersistenceStatus persisted() {
        return new PersistenceStatus(Status.PERSISTED, null);
    }

    public static PersistenceStatus skipped(String error) {
        return new PersistenceStatus(Status.SKIPPED, error);
    }
}

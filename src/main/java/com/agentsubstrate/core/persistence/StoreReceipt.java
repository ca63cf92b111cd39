package com.agentsubstrate.core.persistence;

/**
 * Acknowledgement returned by {@link DecisionEventStore#store}.
 *
 * @param id     ledger-assigned id of the stored record
 * @param stored always true for a successful write
 */
public record StoreReceipt(String id, boolean stored) {
}

package com.agentsubstrate.core.persistence;

import com.agentsubstrate.core.contract.DecisionEvent;

import java.util.List;
import java.util.Optional;

/**
 * Append-only ledger that decision events are written to.
 * <p>
 * Implementations may fail with {@link PersistenceException}; the agent runtime
 * downgrades such failures instead of failing the invocation.
 */
public interface DecisionEventStore {

    /** Name used in logs and in persistence error messages. */
    String name();

    StoreReceipt store(DecisionEvent event);

    Optional<DecisionEvent> retrieve(String executionRef);

    List<DecisionEvent> search(EventQuery query);
}

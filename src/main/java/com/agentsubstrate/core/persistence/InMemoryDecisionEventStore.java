package com.agentsubstrate.core.persistence;

import com.agentsubstrate.core.contract.DecisionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local append-only ledger. Used when no ledger service is configured and in tests.
 */
public class InMemoryDecisionEventStore implements DecisionEventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDecisionEventStore.class);

    private final CopyOnWriteArrayList<DecisionEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public StoreReceipt store(DecisionEvent event) {
        events.add(event);
        String id = "evt-" + sequence.incrementAndGet();
        log.debug("Stored decision event {} as {}", event.executionRef(), id);
        return new StoreReceipt(id, true);
    }

    @Override
    public Optional<DecisionEvent> retrieve(String executionRef) {
        return events.stream()
                .filter(e -> e.executionRef().equals(executionRef))
                .reduce((first, second) -> second);
    }

    @Override
    public List<DecisionEvent> search(EventQuery query) {
        return events.stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(DecisionEvent::timestamp).reversed())
                .limit(query.effectiveLimit())
                .toList();
    }

    public int size() {
        return events.size();
    }
}

package com.agentsubstrate.core.persistence;

import com.agentsubstrate.core.contract.DecisionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDecisionEventStoreTest {

    private static final String HASH = "a".repeat(64);

    private InMemoryDecisionEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDecisionEventStore();
    }

    private static DecisionEvent event(String agentId, String decisionType, String timestamp) {
        return new DecisionEvent(agentId, "1.0.0", decisionType, HASH, null, 0.7, List.of(),
                UUID.randomUUID().toString(), Instant.parse(timestamp));
    }

    @Test
    @DisplayName("store returns a receipt and keeps the event retrievable by execution ref")
    void storeAndRetrieve() {
        DecisionEvent event = event("a", "t", "2024-01-01T00:00:00Z");
        StoreReceipt receipt = store.store(event);
        assertTrue(receipt.stored());
        assertEquals("evt-1", receipt.id());
        assertEquals(event, store.retrieve(event.executionRef()).orElseThrow());
    }

    @Test
    @DisplayName("retrieve returns empty for an unknown ref")
    void retrieveUnknown() {
        assertTrue(store.retrieve(UUID.randomUUID().toString()).isEmpty());
    }

    @Test
    @DisplayName("search filters by agent, decision type and inclusive time window, newest first")
    void search() {
        store.store(event("a", "t1", "2024-01-01T00:00:00Z"));
        store.store(event("a", "t1", "2024-01-02T00:00:00Z"));
        store.store(event("a", "t2", "2024-01-03T00:00:00Z"));
        store.store(event("b", "t1", "2024-01-04T00:00:00Z"));

        List<DecisionEvent> found = store.search(new EventQuery("a", "t1",
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T00:00:00Z"), null));

        assertEquals(2, found.size());
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), found.get(0).timestamp());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), found.get(1).timestamp());
    }

    @Test
    @DisplayName("search honours the limit")
    void limit() {
        for (int i = 1; i <= 5; i++) {
            store.store(event("a", "t", "2024-01-0" + i + "T00:00:00Z"));
        }
        List<DecisionEvent> found = store.search(new EventQuery(null, null, null, null, 2));
        assertEquals(2, found.size());
        assertEquals(Instant.parse("2024-01-05T00:00:00Z"), found.get(0).timestamp());
    }

    @Test
    @DisplayName("default limit is 100")
    void defaultLimit() {
        assertEquals(100, EventQuery.all().effectiveLimit());
        assertEquals(100, new EventQuery(null, null, null, null, 0).effectiveLimit());
    }
}

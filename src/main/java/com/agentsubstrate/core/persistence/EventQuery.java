package com.agentsubstrate.core.persistence;

import com.agentsubstrate.core.contract.DecisionEvent;

import java.time.Instant;

/**
 * Filter for {@link DecisionEventStore#search}. Null fields do not filter.
 *
 * @param agentId       exact agent id
 * @param decisionType  exact decision type
 * @param fromTimestamp inclusive lower bound on the event timestamp
 * @param toTimestamp   inclusive upper bound on the event timestamp
 * @param limit         maximum number of events returned
 */
public record EventQuery(String agentId, String decisionType, Instant fromTimestamp, Instant toTimestamp,
                         Integer limit) {

    public static final int DEFAULT_LIMIT = 100;

    public static EventQuery all() {
        return new EventQuery(null, null, null, null, null);
    }

    public int effectiveLimit() {
        return limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
    }

    boolean matches(DecisionEvent event) {
        if (agentId != null && !agentId.equals(event.agentId())) {
            return false;
        }
        if (decisionType != null && !decisionType.equals(event.decisionType())) {
            return false;
        }
        if (fromTimestamp != null && event.timestamp().isBefore(fromTimestamp)) {
            return false;
        }
        return toTimestamp == null || !event.timestamp().isAfter(toTimestamp);
    }
}

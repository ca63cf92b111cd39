package com.agentsubstrate.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing agent-invocation MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setInvocation(String agentId, String executionRef) {
        MDC.put("agentId", agentId);
        MDC.put("executionRef", executionRef);
    }

    public static void setSpan(String spanId) {
        MDC.put("spanId", spanId);
    }

    public static void clearSpan() {
        MDC.remove("spanId");
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("executionRef");
        MDC.remove("spanId");
    }
}

package com.agentsubstrate.core.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "substrate.runtime")
public class RuntimeProperties {

    /** How long an invocation waits for the ledger write before reporting it as skipped. */
    private Duration persistenceWait = Duration.ofSeconds(30);

    /** Threads available for ledger writes and telemetry calls. */
    private int sideEffectThreads = 4;

    public Duration getPersistenceWait() {
        return persistenceWait;
    }

    public void setPersistenceWait(Duration persistenceWait) {
        this.persistenceWait = persistenceWait;
    }

    public int getSideEffectThreads() {
        return sideEffectThreads;
    }

    public void setSideEffectThreads(int sideEffectThreads) {
        this.sideEffectThreads = sideEffectThreads;
    }
}

package com.agentsubstrate.core.agent;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AgentRuntimeConfig {

    /**
     * Pool for ledger writes and telemetry emission. Daemon threads so a finished CLI run can exit.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentSideEffectExecutor(RuntimeProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getSideEffectThreads()), runnable -> {
            Thread thread = new Thread(runnable, "agent-side-effect-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}

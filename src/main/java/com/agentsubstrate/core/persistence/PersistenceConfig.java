package com.agentsubstrate.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the decision event ledger from {@code substrate.persistence.provider}.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    @ConditionalOnProperty(name = "substrate.persistence.provider", havingValue = "http")
    public DecisionEventStore httpDecisionEventStore(PersistenceProperties properties) {
        log.info("Decision events will be persisted to {} (namespace {})",
                properties.getEndpoint(), properties.getNamespace());
        return new HttpDecisionEventStore(properties);
    }

    @Bean
    @ConditionalOnProperty(name = "substrate.persistence.provider", havingValue = "memory", matchIfMissing = true)
    public DecisionEventStore inMemoryDecisionEventStore() {
        return new InMemoryDecisionEventStore();
    }
}

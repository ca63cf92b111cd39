package com.agentsubstrate.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Decision event ledger settings ({@code substrate.persistence.*}).
 */
@Component
@ConfigurationProperties(prefix = "substrate.persistence")
public class PersistenceProperties {

    /** "memory" keeps events in-process; "http" writes to the ruvector ledger service. */
    private String provider = "memory";
    private String endpoint = "http://localhost:8081";
    private String apiKey = "";
    private String namespace = "agents";
    private Duration timeout = Duration.ofSeconds(30);

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}

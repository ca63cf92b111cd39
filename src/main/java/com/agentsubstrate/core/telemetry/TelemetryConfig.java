package com.agentsubstrate.core.telemetry;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TelemetryConfig {

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry(TelemetryProperties properties) {
        var registry = new SimpleMeterRegistry();
        if (properties.getEndpoint() != null && !properties.getEndpoint().isBlank()) {
            registry.config().commonTags("observatory", properties.getEndpoint());
        }
        return registry;
    }

    @Bean
    public AgentTelemetry agentTelemetry(TelemetryProperties properties, MeterRegistry registry) {
        if (!properties.isEnabled()) {
            return new NoopAgentTelemetry();
        }
        return new MicrometerAgentTelemetry(registry);
    }
}

package com.agentsubstrate.core.telemetry;

import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

class TelemetryConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(TelemetryConfig.class, TelemetryProperties.class);

    @Test
    @DisplayName("telemetry is enabled by default")
    void defaults() {
        var props = new TelemetryProperties();
        assertTrue(props.isEnabled());
        assertEquals("", props.getEndpoint());
    }

    @Test
    @DisplayName("enabled telemetry records through Micrometer")
    void micrometerWhenEnabled() {
        contextRunner.run(context ->
                assertInstanceOf(MicrometerAgentTelemetry.class, context.getBean(AgentTelemetry.class)));
    }

    @Test
    @DisplayName("disabled telemetry falls back to the no-op sink")
    void noopWhenDisabled() {
        contextRunner.withPropertyValues("substrate.telemetry.enabled=false")
                .run(context -> assertInstanceOf(NoopAgentTelemetry.class, context.getBean(AgentTelemetry.class)));
    }

    @Test
    @DisplayName("the observatory endpoint becomes a common tag")
    void endpointTag() {
        contextRunner.withPropertyValues("substrate.telemetry.endpoint=http://observatory:4318")
                .run(context -> {
                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    registry.counter("probe").increment();
                    assertEquals("http://observatory:4318",
                            registry.get("probe").counter().getId().getTag("observatory"));
                });
    }
}

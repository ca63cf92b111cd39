package com.agentsubstrate.core.telemetry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "substrate.telemetry")
public class TelemetryProperties {

    private boolean enabled = true;

    /** Observatory endpoint; recorded as a common tag on every agent meter when set. */
    private String endpoint = "";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }
}

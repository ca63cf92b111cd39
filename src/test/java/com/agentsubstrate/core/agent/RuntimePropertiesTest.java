package com.agentsubstrate.core.agent;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RuntimePropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new RuntimeProperties();
        assertEquals(Duration.ofSeconds(30), props.getPersistenceWait());
        assertEquals(4, props.getSideEffectThreads());
    }
}

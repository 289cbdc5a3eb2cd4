package com.questrail.dcsim.config;

import com.questrail.dcsim.kernel.RunLimits;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationConfigTest
{
    @Test
    void defaults() {
        SimulationConfig config = SimulationConfig.defaults();

        assertEquals("dcsim", config.name());
        assertEquals(RunLimits.unbounded(), config.runLimits());
        assertEquals(0, config.replicaStartupDelay());
        assertTrue(config.logEvents());
        assertFalse(config.releaseIdleVms());
    }

    @Test
    void builderOverridesAndValidates() {
        SimulationConfig config = SimulationConfig.builder()
                .withName("sweep-7")
                .withRunLimits(RunLimits.until(100).withMaxEvents(10_000))
                .withReplicaStartupDelay(3)
                .withLogEvents(false)
                .withReleaseIdleVms(true)
                .build();

        assertEquals("sweep-7", config.name());
        assertEquals(100, config.runLimits().endTime().getAsLong());
        assertEquals(10_000, config.runLimits().maxEvents().getAsLong());
        assertEquals(3, config.replicaStartupDelay());
        assertFalse(config.logEvents());
        assertTrue(config.releaseIdleVms());

        assertThrows(IllegalArgumentException.class,
                () -> SimulationConfig.builder().withReplicaStartupDelay(-1).build());
        assertThrows(NullPointerException.class, () -> SimulationConfig.builder().withName(null).build());
        assertThrows(IllegalArgumentException.class, () -> RunLimits.maxEvents(0));
    }
}

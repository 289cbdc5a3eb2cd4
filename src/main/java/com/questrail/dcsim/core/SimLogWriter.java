package com.questrail.dcsim.core;

import com.questrail.dcsim.api.EventPayload.LogMessage;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.StandardTopic;
import com.questrail.dcsim.kernel.SimulationKernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Writes {@code sim.log} events to the log.
 */
public final class SimLogWriter
{
    private static final Logger log = LoggerFactory.getLogger(SimLogWriter.class);

    private final String runName;

    public SimLogWriter(String runName) {
        this.runName = Objects.requireNonNull(runName, "runName");
    }

    public void install(SimulationKernel kernel) {
        kernel.subscribe(StandardTopic.SIM_LOG, "sim-log-writer", this::onLog);
    }

    private void onLog(SimEvent event) {
        if (event.payload() instanceof LogMessage message) {
            log.info("{}@{}> {}", runName, event.timestamp(), message.message());
        } else {
            log.info("{}@{}> {}", runName, event.timestamp(), event.payload());
        }
    }
}

package com.questrail.dcsim.observability;

import com.questrail.dcsim.api.KernelState;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.kernel.Fault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Production implementation of SimulationObservabilitySink that emits logs via SLF4J.
 *
 * Lines are prefixed with {@code <run name>@<virtual time>>}.
 */
public final class Slf4jSimulationObservabilitySink implements SimulationObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSimulationObservabilitySink.class);

    private final String runName;

    public Slf4jSimulationObservabilitySink(String runName) {
        this.runName = Objects.requireNonNull(runName, "runName");
    }

    @Override
    public void onEventDispatched(SimEvent event) {
        log.debug("{}@{}> [{}] {}", runName, event.timestamp(), event.topic(), event.payload());
    }

    @Override
    public void onEntityTransition(EntityTransitionEvent event) {
        if (event.isCreation()) {
            log.debug("{}@{}> {} {} created as {}",
                runName, event.time(), event.entityKind(), event.entityId(), event.to());
        } else {
            log.debug("{}@{}> {} {}: {} -> {} ({})",
                runName, event.time(), event.entityKind(), event.entityId(),
                event.from(), event.to(), event.cause());
        }
    }

    @Override
    public void onKernelStateChange(KernelState from, KernelState to, long time) {
        switch (to) {
            case RUNNING -> log.info("{}@{}> ======== START ========", runName, time);
            case DRAINED -> log.info("{}@{}> ======== STOP ========", runName, time);
            case ABORTED -> log.error("{}@{}> ======== ABORTED ========", runName, time);
            default -> log.debug("{}@{}> kernel {} -> {}", runName, time, from, to);
        }
    }

    @Override
    public void onFault(Fault fault) {
        if (fault.kind().isFatal()) {
            log.error("{}@{}> {} fault in {}: {}",
                runName, fault.time(), fault.kind(), fault.source(), fault.message(), fault.cause());
        } else {
            log.warn("{}@{}> {} fault in {}: {}",
                runName, fault.time(), fault.kind(), fault.source(), fault.message());
        }
    }
}

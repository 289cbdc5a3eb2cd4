package com.questrail.dcsim.observability;

import com.questrail.dcsim.api.KernelState;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.kernel.Fault;

/**
 * No-op implementation of SimulationObservabilitySink.
 */
public final class NullObservabilitySink implements SimulationObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onEventDispatched(SimEvent event) {}

    @Override
    public void onEntityTransition(EntityTransitionEvent event) {}

    @Override
    public void onKernelStateChange(KernelState from, KernelState to, long time) {}

    @Override
    public void onFault(Fault fault) {}
}

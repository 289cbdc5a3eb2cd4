package com.questrail.dcsim.observability;

import com.questrail.dcsim.api.KernelState;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.kernel.Fault;

/**
 * Main interface for receiving simulation observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * Callbacks run on the kernel thread, inside the dispatch loop; they must not
 * schedule events or mutate entities.
 */
public interface SimulationObservabilitySink {
    /**
     * Called right before an event is handed to its subscribers.
     * @param event the event being dispatched
     */
    void onEventDispatched(SimEvent event);

    /**
     * Called when an entity commits a lifecycle transition.
     * @param event the transition details
     */
    void onEntityTransition(EntityTransitionEvent event);

    /**
     * Called when the kernel loop changes state.
     */
    void onKernelStateChange(KernelState from, KernelState to, long time);

    /**
     * Called for every recorded fault, fatal or not.
     * @param fault the fault
     */
    void onFault(Fault fault);
}

package com.questrail.dcsim.kernel;

/**
 * An event was scheduled before the current virtual time.
 *
 * The offending event is not enqueued; the run continues.
 */
public final class SchedulingFault extends SimulationException
{
    public SchedulingFault(String message) {
        super(message);
    }

    @Override
    public FaultKind kind() {
        return FaultKind.SCHEDULING;
    }
}

package com.questrail.dcsim.kernel;

/**
 * Fault taxonomy of a simulation run.
 */
public enum FaultKind
{
    /** Scheduling before the current virtual time. Rejected, the run continues. */
    SCHEDULING,

    /** Invalid entity mutation. Discarded, the run continues. */
    INVARIANT_VIOLATION,

    /** A subscriber failed during dispatch. Isolated, the run continues. */
    SUBSCRIBER,

    /** Kernel-level fault. The run is aborted. */
    KERNEL;

    public boolean isFatal() {
        return this == KERNEL;
    }
}

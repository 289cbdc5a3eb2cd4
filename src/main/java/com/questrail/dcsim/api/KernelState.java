package com.questrail.dcsim.api;

/**
 * Lifecycle of the simulation kernel's main loop.
 */
public enum KernelState
{
    /** No event has been processed yet. */
    IDLE,

    /** The loop is dispatching events. */
    RUNNING,

    /** The queue is empty or the run horizon was reached. The kernel may be run again. */
    DRAINED,

    /** An unrecoverable fault halted the loop. Partial state is preserved for diagnostics. */
    ABORTED
}

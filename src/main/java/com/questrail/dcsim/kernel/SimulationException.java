package com.questrail.dcsim.kernel;

/**
 * Base type of every fault the simulation raises.
 */
public abstract class SimulationException extends RuntimeException
{
    protected SimulationException(String message) {
        super(message);
    }

    protected SimulationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Classification used when the fault is recorded.
     */
    public abstract FaultKind kind();
}

package com.questrail.dcsim.kernel;

/**
 * Unrecoverable fault: the kernel loop moves to
 * {@link com.questrail.dcsim.api.KernelState#ABORTED}.
 *
 * Raised for queue or clock corruption, for an exhausted safety valve, and by
 * handlers that detect a condition the run must not survive. Event bus
 * isolation does not apply to this type.
 */
public final class KernelFault extends SimulationException
{
    public KernelFault(String message) {
        super(message);
    }

    public KernelFault(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FaultKind kind() {
        return FaultKind.KERNEL;
    }
}

package com.questrail.dcsim.kernel;

/**
 * Virtual simulation clock.
 *
 * - Starts at 0
 * - Advances only when the kernel dispatches the next event
 * - Never goes backwards
 */
public final class VirtualClock
{
    private long now;

    public long now() {
        return now;
    }

    /**
     * Moves the clock to the timestamp of the event about to be dispatched.
     *
     * @throws KernelFault if {@code timestamp} is in the past, which means the
     *         queue handed out events out of order
     */
    void advanceTo(long timestamp) {
        if (timestamp < now) {
            throw new KernelFault("clock cannot move backwards: now=" + now + ", requested=" + timestamp);
        }
        now = timestamp;
    }
}

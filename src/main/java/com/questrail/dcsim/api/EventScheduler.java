package com.questrail.dcsim.api;

/**
 * EventScheduler
 * -----------------------------------------------------------------------------
 * The narrow kernel surface handed to pluggable policies: read the virtual
 * clock and enqueue follow-up events.
 *
 * <p>
 * There is no cancellation. A handler that needs to "undo" a scheduled event
 * checks entity state when that event fires.
 * </p>
 */
public interface EventScheduler
{
    /**
     * Current virtual time.
     */
    long now();

    /**
     * Enqueues an event.
     *
     * @throws com.questrail.dcsim.kernel.SchedulingFault if {@code at} is before {@link #now()}
     */
    SimEvent schedule(Topic topic, long at, EventPayload payload);

    /**
     * Enqueues an event at the current virtual time. It fires after every event
     * already queued for this instant.
     */
    default SimEvent scheduleNow(Topic topic, EventPayload payload) {
        return schedule(topic, now(), payload);
    }
}

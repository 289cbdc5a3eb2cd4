package com.questrail.dcsim.kernel;

import com.questrail.dcsim.api.EventPayload;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.Topic;

import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * EventQueue
 * -----------------------------------------------------------------------------
 * Time-ordered store of pending events.
 *
 * <h2>Ordering</h2>
 * Events come out by {@link SimEvent#ORDER}: smallest timestamp first, and for
 * equal timestamps in insertion order. The insertion counter is owned here, so
 * callers cannot influence tie-breaking.
 *
 * <h2>No past scheduling</h2>
 * Insertion is refused for timestamps before the clock's current time. A
 * refused insertion leaves the queue and the sequence counter untouched.
 */
public final class EventQueue
{
    private final VirtualClock clock;
    private final PriorityQueue<SimEvent> pending = new PriorityQueue<>(SimEvent.ORDER);
    private long nextSequence;

    public EventQueue(VirtualClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates and enqueues an event.
     *
     * @throws SchedulingFault if {@code timestamp} is before the current time
     */
    public SimEvent insert(Topic topic, long timestamp, EventPayload payload) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        if (timestamp < clock.now()) {
            throw new SchedulingFault("cannot schedule " + topic + " at " + timestamp
                    + ", current time is " + clock.now());
        }
        SimEvent event = new SimEvent(topic, timestamp, nextSequence, payload);
        nextSequence++;
        pending.add(event);
        return event;
    }

    /**
     * Returns the earliest event without removing it.
     */
    public Optional<SimEvent> peek() {
        return Optional.ofNullable(pending.peek());
    }

    /**
     * Removes and returns the earliest event, or empty when none remain.
     */
    public Optional<SimEvent> next() {
        return Optional.ofNullable(pending.poll());
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public int size() {
        return pending.size();
    }
}

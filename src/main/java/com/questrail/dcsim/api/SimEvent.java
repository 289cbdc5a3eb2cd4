package com.questrail.dcsim.api;

import java.util.Comparator;
import java.util.Objects;

/**
 * SimEvent
 * -----------------------------------------------------------------------------
 * An immutable, timestamped occurrence flowing through the simulation.
 *
 * <h2>Ordering</h2>
 * Events are totally ordered by {@code (timestamp, sequence)}. The sequence is
 * an insertion counter assigned by the event queue at scheduling time, so
 * events sharing a timestamp are dispatched in the order they were scheduled.
 * Given the same input trace, every run therefore dispatches the same events in
 * the same order.
 *
 * @param topic     category used for subscriber matching
 * @param timestamp virtual time at which the event fires
 * @param sequence  queue insertion counter (tie-break)
 * @param payload   event data
 */
public record SimEvent(Topic topic, long timestamp, long sequence, EventPayload payload)
{
    /**
     * Dispatch order: earliest timestamp first, then scheduling order.
     */
    public static final Comparator<SimEvent> ORDER =
            Comparator.comparingLong(SimEvent::timestamp).thenComparingLong(SimEvent::sequence);

    public SimEvent {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be >= 0");
        }
    }

    /**
     * Returns the payload cast to the expected type.
     *
     * @throws IllegalArgumentException if the payload is of another type
     */
    public <P extends EventPayload> P payloadAs(Class<P> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalArgumentException("event " + topic + " carries "
                    + payload.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        return type.cast(payload);
    }

    @Override
    public String toString() {
        return topic + "@" + timestamp + "#" + sequence + " " + payload;
    }
}

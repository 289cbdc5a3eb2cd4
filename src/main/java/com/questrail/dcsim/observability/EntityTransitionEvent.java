package com.questrail.dcsim.observability;

import com.questrail.dcsim.api.Topic;

import java.util.Objects;

/**
 * Record representing a committed entity lifecycle transition.
 *
 * @param time       virtual time of the transition
 * @param entityKind arena the entity lives in ({@code request}, {@code vm}, ...)
 * @param entityId   entity id
 * @param from       previous status, {@code null} when the entity was just created
 * @param to         new status
 * @param cause      topic of the event whose handler committed the transition
 */
public record EntityTransitionEvent(
    long time,
    String entityKind,
    String entityId,
    Enum<?> from,
    Enum<?> to,
    Topic cause
) {
    public EntityTransitionEvent {
        Objects.requireNonNull(entityKind, "entityKind");
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(cause, "cause");
    }

    /**
     * Checks if this transition created the entity.
     */
    public boolean isCreation() {
        return from == null;
    }
}

package com.questrail.dcsim.model;

import com.questrail.dcsim.api.EventPayload;
import com.questrail.dcsim.api.Topic;

import java.util.Objects;

/**
 * One step of an {@link Action}.
 *
 * The kernel only sequences steps; what a step does is up to the configured
 * {@link com.questrail.dcsim.policy.ActionInterpreter}.
 */
public interface ActionStep
{
    /**
     * Virtual time between the previous step (or the submission, for the first
     * step) and this one.
     */
    long delay();

    /**
     * Step that emits one event when executed.
     */
    record Emit(long delay, Topic topic, EventPayload payload) implements ActionStep {
        public Emit {
            Objects.requireNonNull(topic, "topic");
            Objects.requireNonNull(payload, "payload");
            if (delay < 0) {
                throw new IllegalArgumentException("delay must be >= 0");
            }
        }

        public static Emit now(Topic topic, EventPayload payload) {
            return new Emit(0, topic, payload);
        }
    }
}

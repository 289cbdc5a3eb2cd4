package com.questrail.dcsim.api;

import java.util.Objects;

/**
 * Topic
 * -----------------------------------------------------------------------------
 * The named category of a {@link SimEvent}, used by the event bus to match
 * subscribers.
 *
 * <h2>Closed tag set with an escape hatch</h2>
 * The kernel and its entity handlers only ever react to {@link StandardTopic}s.
 * Experiments that need their own event kinds use a {@link NamedTopic}; such
 * events flow through the same queue and bus but no built-in handler reacts to
 * them.
 *
 * <p>
 * Every topic exposes its exact, stable string identifier (for example
 * {@code request.arrive}). Identifiers are dot-separated segments, which is what
 * family patterns such as {@code deployment.*} match against (see
 * {@link TopicPattern}).
 * </p>
 */
public sealed interface Topic permits StandardTopic, NamedTopic
{
    /**
     * Returns the exact string identifier of this topic.
     */
    String id();

    /**
     * Resolves an identifier to its standard topic, or wraps it in a
     * {@link NamedTopic} when it is not part of the standard catalog.
     */
    static Topic of(String id) {
        Objects.requireNonNull(id, "id");
        return StandardTopic.fromId(id)
                .<Topic>map(t -> t)
                .orElseGet(() -> new NamedTopic(id));
    }
}

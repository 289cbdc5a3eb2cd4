package com.questrail.dcsim.api;

import java.util.Objects;

/**
 * A user-defined topic outside the standard catalog.
 *
 * <p>
 * The identifier must not collide with a {@link StandardTopic} and must not
 * contain the wildcard character; wildcards belong to {@link TopicPattern}.
 * </p>
 */
public record NamedTopic(String id) implements Topic
{
    public NamedTopic {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("topic id must not be blank");
        }
        if (id.indexOf('*') >= 0) {
            throw new IllegalArgumentException("topic id must not contain '*': " + id);
        }
        if (StandardTopic.fromId(id).isPresent()) {
            throw new IllegalArgumentException("topic id is reserved by the standard catalog: " + id);
        }
    }

    @Override
    public String toString() {
        return id;
    }
}

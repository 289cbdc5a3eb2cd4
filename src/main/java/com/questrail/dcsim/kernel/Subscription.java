package com.questrail.dcsim.kernel;

import com.questrail.dcsim.api.EventHandler;
import com.questrail.dcsim.api.TopicPattern;

import java.util.Objects;

/**
 * A handler registered on the {@link EventBus}.
 *
 * @param order   registration index; dispatch follows it
 * @param pattern topics the handler receives
 * @param name    subscriber name used when attributing faults
 * @param handler the handler itself
 */
public record Subscription(long order, TopicPattern pattern, String name, EventHandler handler)
{
    public Subscription {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler");
    }

    @Override
    public String toString() {
        return name + "(" + pattern + ")";
    }
}

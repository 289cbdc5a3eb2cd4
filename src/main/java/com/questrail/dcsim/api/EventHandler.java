package com.questrail.dcsim.api;

/**
 * Subscriber capability registered with the event bus.
 *
 * <p>
 * A handler runs to completion before the next event is dispatched. It may
 * schedule follow-up events but must never schedule into the past. Any
 * exception it throws is recorded as a fault against the subscriber; dispatch to
 * the remaining subscribers continues.
 * </p>
 */
@FunctionalInterface
public interface EventHandler
{
    void handle(SimEvent event) throws Exception;
}

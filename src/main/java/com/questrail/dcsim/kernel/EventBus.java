package com.questrail.dcsim.kernel;

import com.questrail.dcsim.api.EventHandler;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.TopicPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * EventBus
 * -----------------------------------------------------------------------------
 * Topic-keyed registry of subscribers with synchronous delivery.
 *
 * <h2>Dispatch contract</h2>
 * <ul>
 *   <li>Every subscription whose pattern matches the event's topic is invoked,
 *       in registration order</li>
 *   <li>Each handler runs to completion before the next one starts</li>
 *   <li>A failing handler is reported to the {@link FailureListener} and the
 *       remaining handlers still receive the event</li>
 *   <li>{@link KernelFault}s are not isolated: they propagate to the kernel
 *       loop, which aborts the run</li>
 *   <li>An {@link Error} from a handler is wrapped in a {@link KernelFault}</li>
 * </ul>
 *
 * Subscriptions added while an event is being dispatched take effect from the
 * next event on.
 */
public final class EventBus
{
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /**
     * Receives handler failures observed by the bus.
     */
    public interface FailureListener {
        /** A handler failed; dispatch continues with the next subscriber. */
        void onHandlerFailure(Subscription subscription, SimEvent event, Exception failure);

        /** A handler raised a {@link KernelFault}; it is rethrown after this call. */
        void onFatalFailure(Subscription subscription, SimEvent event, KernelFault fault);
    }

    private final List<Subscription> subscriptions = new ArrayList<>();
    private long nextOrder;

    public Subscription subscribe(TopicPattern pattern, String name, EventHandler handler) {
        Subscription subscription = new Subscription(nextOrder++, pattern, name, handler);
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * Removes a subscription.
     *
     * @return {@code true} if it was registered
     */
    public boolean unsubscribe(Subscription subscription) {
        return subscriptions.remove(Objects.requireNonNull(subscription, "subscription"));
    }

    /**
     * Delivers an event to every matching subscriber.
     *
     * @return number of handlers invoked
     * @throws KernelFault if a handler raised one
     */
    public int publish(SimEvent event, FailureListener failures) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(failures, "failures");

        int delivered = 0;
        for (Subscription subscription : List.copyOf(subscriptions)) {
            if (!subscription.pattern().matches(event.topic())) {
                continue;
            }
            delivered++;
            try {
                subscription.handler().handle(event);
            } catch (KernelFault fatal) {
                log.error("Subscriber {} raised a kernel fault on {}", subscription, event, fatal);
                failures.onFatalFailure(subscription, event, fatal);
                throw fatal;
            } catch (Exception e) {
                log.warn("Subscriber {} failed on {}: {}", subscription, event, e.toString());
                failures.onHandlerFailure(subscription, event, e);
            } catch (Error error) {
                KernelFault fatal = new KernelFault("subscriber " + subscription.name() + " raised " + error, error);
                log.error("Subscriber {} raised an error on {}", subscription, event, error);
                failures.onFatalFailure(subscription, event, fatal);
                throw fatal;
            }
        }
        return delivered;
    }
}

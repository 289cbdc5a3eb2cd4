package com.questrail.dcsim.kernel;

import com.questrail.dcsim.api.EventHandler;
import com.questrail.dcsim.api.EventPayload;
import com.questrail.dcsim.api.EventScheduler;
import com.questrail.dcsim.api.KernelState;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.StandardTopic;
import com.questrail.dcsim.api.Topic;
import com.questrail.dcsim.api.TopicPattern;
import com.questrail.dcsim.observability.NullObservabilitySink;
import com.questrail.dcsim.observability.SimulationObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SimulationKernel
 * =============================================================================
 * Discrete-event simulation loop: owns the {@link VirtualClock}, the
 * {@link EventQueue} and the {@link EventBus}.
 *
 * <h2>Main loop</h2>
 * <pre>
 *   pop earliest event → advance clock → publish to bus → handlers schedule follow-ups
 * </pre>
 * until the queue is empty, the run horizon is passed, or a fatal fault occurs.
 *
 * <h2>Threading model</h2>
 * Single-threaded and cooperative. Handlers run one at a time on the thread
 * that called {@link #run(RunLimits)}; "waiting" is expressed by scheduling a
 * future event. The kernel is not thread-safe and needs no locking as long as
 * entity state is only mutated from within dispatched handlers.
 *
 * <h2>Faults</h2>
 * Every fault is recorded in order and forwarded to the observability sink:
 * <ul>
 *   <li>{@link SchedulingFault}: thrown to the caller of {@link #schedule}, run continues</li>
 *   <li>{@link InvariantViolation} and other handler failures: isolated per
 *       subscriber, surfaced as a {@code sim.log} diagnostic, run continues</li>
 *   <li>{@link KernelFault}: the loop stops in {@link KernelState#ABORTED}</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   IDLE → RUNNING → DRAINED → (run again) → RUNNING → ...
 *                  ↘ ABORTED (terminal)
 * </pre>
 */
public final class SimulationKernel implements EventScheduler
{
    private static final Logger log = LoggerFactory.getLogger(SimulationKernel.class);

    private static final String KERNEL_SOURCE = "kernel";

    private final VirtualClock clock = new VirtualClock();
    private final EventQueue queue = new EventQueue(clock);
    private final EventBus bus = new EventBus();
    private final SimulationObservabilitySink observabilitySink;

    private final List<SimEvent> eventLog = new ArrayList<>();
    private final List<Fault> faults = new ArrayList<>();

    private final EventBus.FailureListener failureListener = new EventBus.FailureListener() {
        @Override
        public void onHandlerFailure(Subscription subscription, SimEvent event, Exception failure) {
            isolateFailure(subscription, event, failure);
        }

        @Override
        public void onFatalFailure(Subscription subscription, SimEvent event, KernelFault fault) {
            fatalSource = subscription.name();
        }
    };

    private KernelState state = KernelState.IDLE;
    private String fatalSource;

    public SimulationKernel(SimulationObservabilitySink observabilitySink) {
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public SimulationKernel() {
        this(null);
    }

    // ---------------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------------

    @Override
    public long now() {
        return clock.now();
    }

    @Override
    public SimEvent schedule(Topic topic, long at, EventPayload payload) {
        try {
            return queue.insert(topic, at, payload);
        } catch (SchedulingFault fault) {
            record(new Fault(FaultKind.SCHEDULING, clock.now(), KERNEL_SOURCE, fault.getMessage(), fault));
            throw fault;
        }
    }

    // ---------------------------------------------------------------------
    // Subscription
    // ---------------------------------------------------------------------

    public Subscription subscribe(TopicPattern pattern, String name, EventHandler handler) {
        return bus.subscribe(pattern, name, handler);
    }

    public Subscription subscribe(String pattern, String name, EventHandler handler) {
        return bus.subscribe(TopicPattern.parse(pattern), name, handler);
    }

    public Subscription subscribe(Topic topic, String name, EventHandler handler) {
        return bus.subscribe(TopicPattern.exact(topic), name, handler);
    }

    public boolean unsubscribe(Subscription subscription) {
        return bus.unsubscribe(subscription);
    }

    // ---------------------------------------------------------------------
    // Main loop
    // ---------------------------------------------------------------------

    /**
     * Dispatches events until the queue is empty, the horizon is passed, or a
     * fatal fault occurs.
     *
     * @return the kernel state the run ended in ({@code DRAINED} or {@code ABORTED})
     * @throws IllegalStateException if called re-entrantly or after an abort
     */
    public KernelState run(RunLimits limits) {
        Objects.requireNonNull(limits, "limits");
        if (state == KernelState.RUNNING) {
            throw new IllegalStateException("run() is not re-entrant");
        }
        if (state == KernelState.ABORTED) {
            throw new IllegalStateException("kernel was aborted; start a new simulation");
        }

        transitionTo(KernelState.RUNNING);
        long dispatchedThisRun = 0;
        try {
            while (true) {
                Optional<SimEvent> head = queue.peek();
                if (head.isEmpty() || limits.beyondHorizon(head.get().timestamp())) {
                    transitionTo(KernelState.DRAINED);
                    break;
                }
                if (limits.exhausted(dispatchedThisRun)) {
                    abort(new KernelFault("safety valve: more than " + limits.maxEvents().getAsLong()
                            + " events in one run, " + queue.size() + " still queued"), KERNEL_SOURCE);
                    break;
                }
                SimEvent event = queue.next().orElseThrow(() -> new KernelFault("queue emptied during dispatch"));
                dispatch(event);
                dispatchedThisRun++;
            }
        } catch (KernelFault fault) {
            abort(fault, Objects.requireNonNullElse(fatalSource, KERNEL_SOURCE));
        } catch (RuntimeException e) {
            abort(new KernelFault("unexpected kernel failure", e), KERNEL_SOURCE);
        } catch (Error e) {
            abort(new KernelFault("unexpected kernel error", e), KERNEL_SOURCE);
            throw e;
        }
        return state;
    }

    private void dispatch(SimEvent event) {
        clock.advanceTo(event.timestamp());
        eventLog.add(event);
        observabilitySink.onEventDispatched(event);
        bus.publish(event, failureListener);
    }

    private void isolateFailure(Subscription subscription, SimEvent event, Exception failure) {
        if (failure instanceof SchedulingFault) {
            // recorded by schedule()
            return;
        }
        FaultKind kind = failure instanceof SimulationException se ? se.kind() : FaultKind.SUBSCRIBER;
        String message = event.topic() + ": " + Objects.toString(failure.getMessage(), failure.getClass().getName());
        record(new Fault(kind, clock.now(), subscription.name(), message, failure));

        if (event.topic() != StandardTopic.SIM_LOG) {
            queue.insert(StandardTopic.SIM_LOG, clock.now(),
                    new EventPayload.LogMessage(kind + " in " + subscription.name() + ": " + message));
        }
    }

    private void abort(KernelFault fault, String source) {
        record(new Fault(FaultKind.KERNEL, clock.now(), source, fault.getMessage(), fault));
        transitionTo(KernelState.ABORTED);
    }

    private void transitionTo(KernelState next) {
        KernelState previous = state;
        state = next;
        if (previous != next) {
            log.debug("Kernel state {} -> {} at t={}", previous, next, clock.now());
            observabilitySink.onKernelStateChange(previous, next, clock.now());
        }
    }

    /**
     * Records a fault detected outside of handler isolation, for example a
     * policy decision refused by entity bookkeeping, and surfaces it as a
     * {@code sim.log} diagnostic.
     */
    public void reportFault(FaultKind kind, String source, String message, Throwable cause) {
        if (kind.isFatal()) {
            throw new IllegalArgumentException("fatal faults are raised as KernelFault, not reported");
        }
        record(new Fault(kind, clock.now(), source, message, cause));
        queue.insert(StandardTopic.SIM_LOG, clock.now(),
                new EventPayload.LogMessage(kind + " in " + source + ": " + message));
    }

    private void record(Fault fault) {
        faults.add(fault);
        observabilitySink.onFault(fault);
    }

    // ---------------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------------

    public KernelState state() {
        return state;
    }

    /**
     * Every dispatched event, in dispatch order.
     */
    public List<SimEvent> eventLog() {
        return Collections.unmodifiableList(eventLog);
    }

    /**
     * Every fault encountered so far, in order.
     */
    public List<Fault> faults() {
        return Collections.unmodifiableList(faults);
    }

    public long dispatchedCount() {
        return eventLog.size();
    }

    public int pendingCount() {
        return queue.size();
    }

    public Optional<SimEvent> nextPending() {
        return queue.peek();
    }
}

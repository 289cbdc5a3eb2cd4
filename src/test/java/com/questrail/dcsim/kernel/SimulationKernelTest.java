package com.questrail.dcsim.kernel;

import com.questrail.dcsim.api.EventPayload.LogMessage;
import com.questrail.dcsim.api.KernelState;
import com.questrail.dcsim.api.NamedTopic;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.StandardTopic;
import com.questrail.dcsim.api.Topic;
import com.questrail.dcsim.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SimulationKernelTest
{
    private static final Topic TICK = new NamedTopic("experiment.tick");

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final SimulationKernel kernel = new SimulationKernel(sink);

    private static LogMessage msg(String text) {
        return new LogMessage(text);
    }

    private List<String> dispatchedMessages() {
        return kernel.eventLog().stream()
                .filter(e -> e.topic() == TICK)
                .map(e -> ((LogMessage) e.payload()).message())
                .collect(Collectors.toList());
    }

    @Test
    void startsIdleAndDrainsEmptyQueue() {
        assertEquals(KernelState.IDLE, kernel.state());
        assertEquals(KernelState.DRAINED, kernel.run(RunLimits.unbounded()));
        assertEquals(0, kernel.dispatchedCount());
    }

    @Test
    void dispatchesByTimestampThenSchedulingOrder() {
        kernel.schedule(TICK, 3, msg("t3"));
        kernel.schedule(TICK, 1, msg("t1-a"));
        kernel.schedule(TICK, 1, msg("t1-b"));
        kernel.schedule(TICK, 0, msg("t0"));

        kernel.run(RunLimits.unbounded());

        assertEquals(List.of("t0", "t1-a", "t1-b", "t3"), dispatchedMessages());
        assertEquals(3, kernel.now());
    }

    @Test
    void clockIsAdvancedBeforeHandlersRun() {
        List<Long> seen = new ArrayList<>();
        kernel.subscribe(TICK, "clock-watcher", e -> seen.add(kernel.now()));
        kernel.schedule(TICK, 4, msg("a"));
        kernel.schedule(TICK, 9, msg("b"));

        kernel.run(RunLimits.unbounded());

        assertEquals(List.of(4L, 9L), seen);
    }

    @Test
    void followUpsAtTheSameInstantRunAfterAlreadyQueuedEvents() {
        kernel.subscribe(TICK, "chain", e -> {
            String text = ((LogMessage) e.payload()).message();
            if (text.equals("a")) {
                kernel.scheduleNow(TICK, msg("a-child"));
            }
        });
        kernel.schedule(TICK, 2, msg("a"));
        kernel.schedule(TICK, 2, msg("b"));

        kernel.run(RunLimits.unbounded());

        assertEquals(List.of("a", "b", "a-child"), dispatchedMessages());
    }

    @Test
    void schedulingIntoThePastIsRejectedAndTheRunContinues() {
        List<String> outcome = new ArrayList<>();
        kernel.subscribe(TICK, "time-traveller", e -> {
            try {
                kernel.schedule(TICK, 1, msg("past"));
            } catch (SchedulingFault expected) {
                outcome.add(expected.getMessage());
            }
        });
        kernel.schedule(TICK, 5, msg("now"));

        assertEquals(KernelState.DRAINED, kernel.run(RunLimits.unbounded()));

        assertEquals(1, outcome.size());
        assertEquals(List.of("now"), dispatchedMessages());
        assertEquals(1, kernel.faults().size());
        assertEquals(FaultKind.SCHEDULING, kernel.faults().get(0).kind());
        assertEquals(0, kernel.pendingCount());
    }

    @Test
    void schedulingFaultEscapingAHandlerIsRecordedOnce() {
        kernel.subscribe(TICK, "careless", e -> kernel.schedule(TICK, 0, msg("past")));
        kernel.schedule(TICK, 5, msg("now"));

        assertEquals(KernelState.DRAINED, kernel.run(RunLimits.unbounded()));

        assertEquals(1, kernel.faults().size());
        assertEquals(FaultKind.SCHEDULING, kernel.faults().get(0).kind());
    }

    @Test
    void subscriberFaultIsIsolatedAndSurfacedAsSimLog() {
        List<String> logged = new ArrayList<>();
        List<String> delivered = new ArrayList<>();
        kernel.subscribe(TICK, "broken", e -> {
            throw new IllegalStateException("boom");
        });
        kernel.subscribe(TICK, "healthy", e -> delivered.add("healthy"));
        kernel.subscribe(StandardTopic.SIM_LOG, "log-recorder", e -> logged.add(((LogMessage) e.payload()).message()));
        kernel.schedule(TICK, 1, msg("x"));

        assertEquals(KernelState.DRAINED, kernel.run(RunLimits.unbounded()));

        assertEquals(List.of("healthy"), delivered);
        assertEquals(1, kernel.faults().size());
        Fault fault = kernel.faults().get(0);
        assertEquals(FaultKind.SUBSCRIBER, fault.kind());
        assertEquals("broken", fault.source());
        assertEquals(1, fault.time());
        assertEquals(1, logged.size());
        assertTrue(logged.get(0).contains("broken"));
        assertEquals(List.of(fault), sink.getFaults());
    }

    @Test
    void invariantViolationsKeepTheirKind() {
        kernel.subscribe(TICK, "strict", e -> {
            throw new InvariantViolation("bad transition");
        });
        kernel.schedule(TICK, 0, msg("x"));

        kernel.run(RunLimits.unbounded());

        assertEquals(FaultKind.INVARIANT_VIOLATION, kernel.faults().get(0).kind());
    }

    @Test
    void failingSimLogSubscriberDoesNotRecurse() {
        kernel.subscribe(StandardTopic.SIM_LOG, "broken-log", e -> {
            throw new IllegalStateException("log failure");
        });
        kernel.schedule(StandardTopic.SIM_LOG, 0, msg("hello"));

        assertEquals(KernelState.DRAINED, kernel.run(RunLimits.maxEvents(10)));

        assertEquals(1, kernel.dispatchedCount());
        assertEquals(1, kernel.faults().size());
    }

    @Test
    void kernelFaultFromHandlerAbortsAndPreservesPartialState() {
        kernel.subscribe(TICK, "fatal", e -> {
            if (((LogMessage) e.payload()).message().equals("b")) {
                throw new KernelFault("corrupted");
            }
        });
        kernel.schedule(TICK, 1, msg("a"));
        kernel.schedule(TICK, 2, msg("b"));
        kernel.schedule(TICK, 3, msg("c"));

        assertEquals(KernelState.ABORTED, kernel.run(RunLimits.unbounded()));

        assertEquals(List.of("a", "b"), dispatchedMessages());
        assertEquals(1, kernel.pendingCount());
        Fault fault = kernel.faults().get(kernel.faults().size() - 1);
        assertEquals(FaultKind.KERNEL, fault.kind());
        assertEquals("fatal", fault.source());
        assertThrows(IllegalStateException.class, () -> kernel.run(RunLimits.unbounded()));
    }

    @Test
    void errorFromHandlerAbortsInsteadOfLeavingTheKernelRunning() {
        kernel.subscribe(TICK, "deep-chain", e -> {
            throw new StackOverflowError();
        });
        kernel.schedule(TICK, 1, msg("a"));
        kernel.schedule(TICK, 2, msg("b"));

        assertEquals(KernelState.ABORTED, kernel.run(RunLimits.unbounded()));

        assertEquals(KernelState.ABORTED, kernel.state());
        assertEquals(List.of("a"), dispatchedMessages());
        Fault fault = kernel.faults().get(kernel.faults().size() - 1);
        assertEquals(FaultKind.KERNEL, fault.kind());
        assertEquals("deep-chain", fault.source());
        assertInstanceOf(StackOverflowError.class, fault.cause().getCause());
        IllegalStateException refused = assertThrows(IllegalStateException.class,
                () -> kernel.run(RunLimits.unbounded()));
        assertTrue(refused.getMessage().contains("aborted"));
    }

    @Test
    void safetyValveAbortsPerpetualRescheduling() {
        kernel.subscribe(TICK, "forever", e -> kernel.schedule(TICK, kernel.now() + 1, msg("again")));
        kernel.schedule(TICK, 0, msg("start"));

        assertEquals(KernelState.ABORTED, kernel.run(RunLimits.maxEvents(100)));

        assertEquals(100, kernel.dispatchedCount());
        assertEquals(FaultKind.KERNEL, kernel.faults().get(0).kind());
        assertEquals("kernel", kernel.faults().get(0).source());
    }

    @Test
    void horizonLeavesLaterEventsQueuedAndAllowsResume() {
        kernel.schedule(TICK, 1, msg("a"));
        kernel.schedule(TICK, 5, msg("b"));
        kernel.schedule(TICK, 6, msg("c"));

        assertEquals(KernelState.DRAINED, kernel.run(RunLimits.until(5)));
        assertEquals(List.of("a", "b"), dispatchedMessages());
        assertEquals(6, kernel.nextPending().map(SimEvent::timestamp).orElseThrow());

        assertEquals(KernelState.DRAINED, kernel.run(RunLimits.unbounded()));
        assertEquals(List.of("a", "b", "c"), dispatchedMessages());
        assertTrue(kernel.faults().isEmpty());
    }

    @Test
    void runIsNotReentrant() {
        List<Exception> caught = new ArrayList<>();
        kernel.subscribe(TICK, "reentrant", e -> {
            try {
                kernel.run(RunLimits.unbounded());
            } catch (IllegalStateException expected) {
                caught.add(expected);
            }
        });
        kernel.schedule(TICK, 0, msg("x"));

        kernel.run(RunLimits.unbounded());

        assertEquals(1, caught.size());
    }

    @Test
    void kernelStateChangesAreObservable() {
        kernel.schedule(TICK, 2, msg("x"));
        kernel.run(RunLimits.unbounded());

        List<RecordingObservabilitySink.KernelStateChange> changes = sink.getKernelStateChanges();
        assertEquals(2, changes.size());
        assertEquals(KernelState.RUNNING, changes.get(0).to());
        assertEquals(KernelState.DRAINED, changes.get(1).to());
        assertEquals(2, changes.get(1).time());
    }

    @Test
    void reportingAFatalKindIsRefused() {
        assertThrows(IllegalArgumentException.class,
                () -> kernel.reportFault(FaultKind.KERNEL, "x", "y", null));
    }
}

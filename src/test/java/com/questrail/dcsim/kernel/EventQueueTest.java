package com.questrail.dcsim.kernel;

import com.questrail.dcsim.api.EventPayload.LogMessage;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.StandardTopic;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventQueueTest
{
    private final VirtualClock clock = new VirtualClock();
    private final EventQueue queue = new EventQueue(clock);

    private static LogMessage msg(String text) {
        return new LogMessage(text);
    }

    private List<String> drain() {
        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            SimEvent event = queue.next().orElseThrow();
            order.add(((LogMessage) event.payload()).message());
        }
        return order;
    }

    @Test
    void earlierTimestampsComeOutFirst() {
        queue.insert(StandardTopic.SIM_LOG, 5, msg("c"));
        queue.insert(StandardTopic.SIM_LOG, 1, msg("a"));
        queue.insert(StandardTopic.SIM_LOG, 3, msg("b"));

        assertEquals(List.of("a", "b", "c"), drain());
    }

    @Test
    void equalTimestampsKeepSchedulingOrder() {
        queue.insert(StandardTopic.SIM_LOG, 2, msg("first"));
        queue.insert(StandardTopic.REQUEST_ARRIVE, 2, msg("second"));
        queue.insert(StandardTopic.SIM_LOG, 0, msg("zero"));
        queue.insert(StandardTopic.SIM_LOG, 2, msg("third"));

        assertEquals(List.of("zero", "first", "second", "third"), drain());
    }

    @Test
    void sequenceIsAssignedByTheQueue() {
        SimEvent a = queue.insert(StandardTopic.SIM_LOG, 7, msg("a"));
        SimEvent b = queue.insert(StandardTopic.SIM_LOG, 3, msg("b"));

        assertEquals(0, a.sequence());
        assertEquals(1, b.sequence());
        assertEquals(b, queue.peek().orElseThrow());
        assertEquals(2, queue.size());
    }

    @Test
    void pastInsertionIsRefusedAndLeavesQueueUntouched() {
        queue.insert(StandardTopic.SIM_LOG, 10, msg("future"));
        clock.advanceTo(5);

        SchedulingFault fault = assertThrows(SchedulingFault.class,
                () -> queue.insert(StandardTopic.SIM_LOG, 4, msg("past")));
        assertEquals(FaultKind.SCHEDULING, fault.kind());
        assertEquals(1, queue.size());

        SimEvent next = queue.insert(StandardTopic.SIM_LOG, 5, msg("now"));
        assertEquals(1, next.sequence());
    }

    @Test
    void emptyQueueSignalsEmpty() {
        assertTrue(queue.next().isEmpty());
        assertTrue(queue.peek().isEmpty());
    }

    @Test
    void clockNeverMovesBackwards() {
        clock.advanceTo(3);
        assertThrows(KernelFault.class, () -> clock.advanceTo(2));
        assertEquals(3, clock.now());
    }
}

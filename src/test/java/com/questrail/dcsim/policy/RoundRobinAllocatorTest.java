package com.questrail.dcsim.policy;

import com.questrail.dcsim.model.PhysicalMachine;
import com.questrail.dcsim.model.Resources;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RoundRobinAllocatorTest
{
    @Test
    void rotatesThroughHosts() {
        Allocator allocator = new RoundRobinAllocator();
        List<PhysicalMachine> pool = List.of(
                PhysicalMachine.of("a", Resources.ofCpu(4)),
                PhysicalMachine.of("b", Resources.ofCpu(4)),
                PhysicalMachine.of("c", Resources.ofCpu(4)));

        assertEquals(Optional.of("a"), allocator.selectPm(Resources.ofCpu(1), pool));
        assertEquals(Optional.of("b"), allocator.selectPm(Resources.ofCpu(1), pool));
        assertEquals(Optional.of("c"), allocator.selectPm(Resources.ofCpu(1), pool));
        assertEquals(Optional.of("a"), allocator.selectPm(Resources.ofCpu(1), pool));
    }

    @Test
    void skipsHostsWithoutRoom() {
        Allocator allocator = new RoundRobinAllocator();
        List<PhysicalMachine> pool = List.of(
                PhysicalMachine.of("a", Resources.ofCpu(4)),
                PhysicalMachine.of("b", Resources.ofCpu(1)),
                PhysicalMachine.of("c", Resources.ofCpu(4)));

        assertEquals(Optional.of("a"), allocator.selectPm(Resources.ofCpu(2), pool));
        assertEquals(Optional.of("c"), allocator.selectPm(Resources.ofCpu(2), pool));
        assertEquals(Optional.of("a"), allocator.selectPm(Resources.ofCpu(2), pool));
        assertTrue(allocator.selectPm(Resources.ofCpu(5), pool).isEmpty());
    }
}

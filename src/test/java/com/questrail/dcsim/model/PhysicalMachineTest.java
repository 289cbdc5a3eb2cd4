package com.questrail.dcsim.model;

import com.questrail.dcsim.kernel.InvariantViolation;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PhysicalMachineTest
{
    @Test
    void allocateAndReleaseTrackCapacity() {
        PhysicalMachine pm = PhysicalMachine.of("pm1", Resources.of(8, 16));

        PhysicalMachine loaded = pm.allocate("vm1", Resources.of(3, 4));
        assertEquals(Resources.of(5, 12), loaded.free());
        assertTrue(loaded.hosts("vm1"));
        assertTrue(pm.free().equals(Resources.of(8, 16)), "source value is unchanged");

        PhysicalMachine released = loaded.release("vm1", Resources.of(3, 4));
        assertEquals(Resources.ZERO, released.allocated());
        assertFalse(released.hosts("vm1"));
    }

    @Test
    void overcommitIsRefusedInEveryDimension() {
        PhysicalMachine pm = PhysicalMachine.of("pm1", Resources.of(4, 4));

        assertThrows(InvariantViolation.class, () -> pm.allocate("cpu-heavy", Resources.of(5, 1)));
        assertThrows(InvariantViolation.class, () -> pm.allocate("ram-heavy", Resources.of(1, 5)));

        PhysicalMachine full = pm.allocate("exact", Resources.of(4, 4));
        assertThrows(InvariantViolation.class, () -> full.allocate("one-more", Resources.ofCpu(1)));
        assertTrue(full.canHost(Resources.ZERO));
    }

    @Test
    void vmCanOnlyBeBoundOnce() {
        PhysicalMachine pm = PhysicalMachine.of("pm1", Resources.ofCpu(10)).allocate("vm1", Resources.ofCpu(1));

        assertThrows(InvariantViolation.class, () -> pm.allocate("vm1", Resources.ofCpu(1)));
        assertThrows(InvariantViolation.class, () -> pm.release("vm2", Resources.ofCpu(1)));
    }

    @Test
    void inconsistentValuesCannotBeConstructed() {
        assertThrows(InvariantViolation.class,
                () -> new PhysicalMachine("pm1", Resources.ofCpu(1), Resources.ofCpu(2), Set.of()));
    }
}

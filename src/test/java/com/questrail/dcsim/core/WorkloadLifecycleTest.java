package com.questrail.dcsim.core;

import com.questrail.dcsim.CloudSimulation;
import com.questrail.dcsim.api.EventPayload.RequestArrival;
import com.questrail.dcsim.api.EventPayload.VmAllocation;
import com.questrail.dcsim.api.EventPayload.WorkloadChange;
import com.questrail.dcsim.api.StandardTopic;
import com.questrail.dcsim.config.SimulationConfig;
import com.questrail.dcsim.kernel.FaultKind;
import com.questrail.dcsim.model.RequestStatus;
import com.questrail.dcsim.model.Resources;
import com.questrail.dcsim.model.VmStatus;
import com.questrail.dcsim.model.Workload;
import com.questrail.dcsim.model.WorkloadKind;
import com.questrail.dcsim.model.WorkloadStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WorkloadLifecycleTest
{
    private CloudSimulation sim;

    @BeforeEach
    void setUp() {
        sim = CloudSimulation.builder()
                .withConfig(SimulationConfig.builder().withName("workloads").withLogEvents(false).build())
                .addHost("pm1", Resources.ofCpu(4))
                .build();
        sim.kernel().schedule(StandardTopic.VM_ALLOCATE, 0, VmAllocation.standalone("vm1", Resources.ofCpu(1)));
        sim.kernel().schedule(StandardTopic.VM_ALLOCATE, 0, VmAllocation.standalone("vm2", Resources.ofCpu(1)));
    }

    private void at(long time, StandardTopic topic, String workloadId, String vmId) {
        sim.kernel().schedule(topic, time, WorkloadChange.onVm(workloadId, vmId));
    }

    @Test
    void startRegistersUnknownWorkloadAndStopEndsIt() {
        at(1, StandardTopic.CONTAINER_START, "c1", "vm1");
        sim.run();

        Workload running = sim.context().workloads().require("c1");
        assertEquals(WorkloadKind.CONTAINER, running.kind());
        assertEquals(WorkloadStatus.RUNNING, running.status());

        at(2, StandardTopic.CONTAINER_STOP, "c1", "vm1");
        sim.run();

        assertEquals(WorkloadStatus.STOPPED, sim.context().workloads().require("c1").status());
        assertTrue(sim.kernel().faults().isEmpty());
    }

    @Test
    void stoppedWorkloadCanBeRestartedOnAnotherVm() {
        at(1, StandardTopic.APP_START, "app", "vm1");
        at(2, StandardTopic.APP_STOP, "app", "vm1");
        at(3, StandardTopic.APP_START, "app", "vm2");

        sim.run();

        Workload app = sim.context().workloads().require("app");
        assertEquals(WorkloadStatus.RUNNING, app.status());
        assertEquals("vm2", app.vmId());
        assertTrue(sim.kernel().faults().isEmpty());
    }

    @Test
    void startOnVmThatIsNotAllocatedIsRefused() {
        sim.kernel().schedule(StandardTopic.VM_ALLOCATE, 0, VmAllocation.standalone("huge", Resources.ofCpu(40)));
        at(1, StandardTopic.CONTAINER_START, "c1", "huge");
        at(1, StandardTopic.CONTAINER_START, "c2", "missing-vm");

        sim.run();

        assertFalse(sim.context().workloads().contains("c1"));
        assertFalse(sim.context().workloads().contains("c2"));
        assertEquals(2, sim.kernel().faults().stream()
                .filter(f -> f.source().equals("workload-lifecycle.container.start"))
                .count());
    }

    @Test
    void invalidTransitionsLeaveTheLastValidState() {
        at(1, StandardTopic.CONTROLLER_START, "ctl", "vm1");
        at(2, StandardTopic.CONTROLLER_START, "ctl", "vm1");
        at(3, StandardTopic.CONTROLLER_STOP, "ctl", "vm2");
        at(4, StandardTopic.APP_STOP, "ctl", "vm1");

        sim.run();

        assertEquals(WorkloadStatus.RUNNING, sim.context().workloads().require("ctl").status());
        assertEquals(3, sim.kernel().faults().size());
        assertTrue(sim.kernel().faults().stream().allMatch(f -> f.kind() == FaultKind.INVARIANT_VIOLATION));
    }

    private List<Long> stopTimes(StandardTopic topic) {
        return sim.kernel().eventLog().stream()
                .filter(e -> e.topic() == topic)
                .map(e -> e.timestamp())
                .collect(Collectors.toList());
    }

    @Test
    void workloadWithLengthStopsOnItsOwn() {
        sim.kernel().schedule(StandardTopic.APP_START, 1, WorkloadChange.onVm("batch", "vm1").withLength(5));

        sim.run();

        assertEquals(WorkloadStatus.STOPPED, sim.context().workloads().require("batch").status());
        assertEquals(List.of(6L), stopTimes(StandardTopic.APP_STOP));
        assertTrue(sim.kernel().faults().isEmpty());
    }

    @Test
    void expirationCutsWorkloadShort() {
        sim.kernel().schedule(StandardTopic.CONTAINER_START, 1,
                WorkloadChange.onVm("job", "vm1").withLength(10).withExpiration(4));
        sim.kernel().schedule(StandardTopic.CONTAINER_START, 5,
                WorkloadChange.onVm("late", "vm2").withExpiration(3));

        sim.run();

        assertEquals(List.of(4L, 5L), stopTimes(StandardTopic.CONTAINER_STOP));
        assertEquals(WorkloadStatus.STOPPED, sim.context().workloads().require("job").status());
        assertEquals(WorkloadStatus.STOPPED, sim.context().workloads().require("late").status());
        assertTrue(sim.kernel().faults().isEmpty());
    }

    @Test
    void completionOfAnEarlierRunDoesNotStopTheRestartedWorkload() {
        sim.kernel().schedule(StandardTopic.APP_START, 1, WorkloadChange.onVm("app", "vm1").withLength(5));
        at(2, StandardTopic.APP_STOP, "app", "vm1");
        at(3, StandardTopic.APP_START, "app", "vm1");

        sim.run();

        assertEquals(WorkloadStatus.RUNNING, sim.context().workloads().require("app").status());
        assertEquals(List.of(2L, 6L), stopTimes(StandardTopic.APP_STOP));
        assertTrue(sim.kernel().faults().isEmpty());
    }

    private static CloudSimulation idleReleasing(boolean releaseIdleVms) {
        CloudSimulation sim = CloudSimulation.builder()
                .withConfig(SimulationConfig.builder()
                        .withName("idle")
                        .withLogEvents(false)
                        .withReleaseIdleVms(releaseIdleVms)
                        .build())
                .addHost("pm1", Resources.ofCpu(4))
                .build();
        sim.arrive(0, RequestArrival.of("r1", "vm-r1", Resources.ofCpu(2)));
        sim.kernel().schedule(StandardTopic.APP_START, 1, WorkloadChange.onVm("a1", "vm-r1").withLength(3));
        sim.kernel().schedule(StandardTopic.APP_START, 1, WorkloadChange.onVm("a2", "vm-r1").withLength(5));
        return sim;
    }

    @Test
    void idleVmIsReleasedAfterItsLastWorkloadFinishes() {
        CloudSimulation idle = idleReleasing(true);
        idle.stopRequest(10, "r1");

        idle.run();

        assertEquals(VmStatus.DEALLOCATED, idle.context().vms().require("vm-r1").status());
        assertEquals(Resources.ZERO, idle.context().hosts().require("pm1").allocated());
        List<Long> releases = idle.kernel().eventLog().stream()
                .filter(e -> e.topic() == StandardTopic.VM_DEALLOCATE)
                .map(e -> e.timestamp())
                .collect(Collectors.toList());
        assertEquals(List.of(6L), releases);
        assertEquals(RequestStatus.STOPPED, idle.context().requests().require("r1").status());
        assertTrue(idle.kernel().faults().isEmpty());
    }

    @Test
    void idleVmIsKeptWhenReleaseIsDisabled() {
        CloudSimulation idle = idleReleasing(false);

        idle.run();

        assertEquals(VmStatus.ALLOCATED, idle.context().vms().require("vm-r1").status());
        assertFalse(idle.kernel().eventLog().stream().anyMatch(e -> e.topic() == StandardTopic.VM_IDLE));
    }

    @Test
    void requestStopAndIdleReleaseDeallocateOnce() {
        CloudSimulation idle = idleReleasing(true);
        idle.stopRequest(2, "r1");

        idle.run();

        assertEquals(VmStatus.DEALLOCATED, idle.context().vms().require("vm-r1").status());
        assertEquals(1, idle.kernel().eventLog().stream().filter(e -> e.topic() == StandardTopic.VM_DEALLOCATE).count());
        assertTrue(idle.kernel().faults().isEmpty());
    }
}

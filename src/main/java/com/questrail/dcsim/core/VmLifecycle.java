package com.questrail.dcsim.core;

import com.questrail.dcsim.api.EventPayload.RequestDecision;
import com.questrail.dcsim.api.EventPayload.VmAllocation;
import com.questrail.dcsim.api.EventPayload.VmDeallocation;
import com.questrail.dcsim.api.EventPayload.VmIdle;
import com.questrail.dcsim.api.EventPayload.WorkloadChange;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.StandardTopic;
import com.questrail.dcsim.kernel.FaultKind;
import com.questrail.dcsim.kernel.InvariantViolation;
import com.questrail.dcsim.kernel.SimulationKernel;
import com.questrail.dcsim.model.PhysicalMachine;
import com.questrail.dcsim.model.VirtualMachine;
import com.questrail.dcsim.model.VmStatus;
import com.questrail.dcsim.model.Workload;
import com.questrail.dcsim.policy.Allocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * VmLifecycle
 * -----------------------------------------------------------------------------
 * Binds VMs to hosts on {@code vm.allocate} and unbinds them on
 * {@code vm.deallocate}.
 *
 * <h2>Placement</h2>
 * The configured {@link Allocator} picks the host. The choice is committed
 * through {@link PhysicalMachine#allocate}, which refuses anything that would
 * overcommit the host; a refused choice is recorded as an invariant fault and
 * treated as "no capacity". A successful placement emits nothing further
 * except the acceptance of the request the VM serves, if any; a failed one
 * leaves the VM {@link VmStatus#UNALLOCATED} and rejects that request.
 *
 * <h2>Idle release</h2>
 * {@code vm.idle} schedules {@code vm.deallocate} for a request's VM that is
 * still allocated and still has no running workload when the event fires.
 *
 * <h2>Stale events</h2>
 * There is no event cancellation. Both handlers check the VM's current status
 * before mutating and raise an {@link InvariantViolation} when the event no
 * longer applies.
 */
public final class VmLifecycle
{
    private static final Logger log = LoggerFactory.getLogger(VmLifecycle.class);

    static final String ENTITY = "vm";
    static final String HOST_ENTITY = "pm";

    static final String NO_CAPACITY = "no capacity";
    static final String UNPLACEABLE = "unplaceable";

    private static final String SOURCE = "vm-lifecycle.allocate";

    private final SimulationContext context;
    private final Allocator allocator;

    public VmLifecycle(SimulationContext context, Allocator allocator) {
        this.context = Objects.requireNonNull(context, "context");
        this.allocator = Objects.requireNonNull(allocator, "allocator");
    }

    public void install() {
        SimulationKernel kernel = context.kernel();
        kernel.subscribe(StandardTopic.VM_ALLOCATE, SOURCE, this::onAllocate);
        kernel.subscribe(StandardTopic.VM_DEALLOCATE, "vm-lifecycle.deallocate", this::onDeallocate);
        kernel.subscribe(StandardTopic.VM_IDLE, "vm-lifecycle.idle", this::onIdle);
    }

    private void onAllocate(SimEvent event) {
        VmAllocation allocation = event.payloadAs(VmAllocation.class);
        Optional<VirtualMachine> known = context.vms().find(allocation.vmId());
        VirtualMachine vm = known.orElseGet(() -> VirtualMachine.unallocated(allocation.vmId(),
                allocation.demand(), allocation.requestId(), allocation.deploymentId()));
        if (vm.status() != VmStatus.UNALLOCATED) {
            throw new InvariantViolation("vm " + vm.id() + " is already " + vm.status());
        }
        if (known.isEmpty()) {
            context.vms().create(vm);
            context.recordTransition(ENTITY, vm.id(), null, vm.status(), event);
        }

        SimulationKernel kernel = context.kernel();
        Optional<String> failure = place(vm, event);
        if (failure.isPresent()) {
            log.debug("VM {} not placed: {}", vm.id(), failure.get());
            vm.request().ifPresent(requestId -> kernel.scheduleNow(StandardTopic.REQUEST_REJECT,
                    RequestDecision.rejected(requestId, failure.get())));
        } else {
            vm.request().ifPresent(requestId -> kernel.scheduleNow(StandardTopic.REQUEST_ACCEPT,
                    RequestDecision.accepted(requestId)));
        }
    }

    /**
     * Tries to place the VM.
     *
     * @return the failure reason, or empty when the VM was placed
     */
    private Optional<String> place(VirtualMachine vm, SimEvent event) {
        Collection<PhysicalMachine> pool = context.hosts().values();
        if (pool.stream().noneMatch(pm -> vm.demand().fitsWithin(pm.capacity()))) {
            return Optional.of(UNPLACEABLE);
        }

        Optional<String> choice = allocator.selectPm(vm.demand(), pool);
        if (choice.isEmpty()) {
            return Optional.of(NO_CAPACITY);
        }

        SimulationKernel kernel = context.kernel();
        Optional<PhysicalMachine> host = context.hosts().find(choice.get());
        if (host.isEmpty()) {
            kernel.reportFault(FaultKind.INVARIANT_VIOLATION, SOURCE,
                    "allocator chose unknown pm " + choice.get() + " for vm " + vm.id(), null);
            return Optional.of(NO_CAPACITY);
        }

        PhysicalMachine updated;
        try {
            updated = host.get().allocate(vm.id(), vm.demand());
        } catch (InvariantViolation refused) {
            kernel.reportFault(FaultKind.INVARIANT_VIOLATION, SOURCE, refused.getMessage(), refused);
            return Optional.of(NO_CAPACITY);
        }

        VirtualMachine placed = vm.allocatedOn(updated.id());
        context.hosts().put(updated);
        context.vms().put(placed);
        context.recordTransition(ENTITY, placed.id(), vm.status(), placed.status(), event);
        log.debug("VM {} placed on {} (free {})", placed.id(), updated.id(), updated.free());
        return Optional.empty();
    }

    private void onDeallocate(SimEvent event) {
        VmDeallocation deallocation = event.payloadAs(VmDeallocation.class);
        VirtualMachine vm = context.vms().require(deallocation.vmId());
        VirtualMachine released = vm.deallocated();
        PhysicalMachine host = context.hosts().require(vm.hostPmId());
        PhysicalMachine freed = host.release(vm.id(), vm.demand());

        context.hosts().put(freed);
        context.vms().put(released);
        context.recordTransition(ENTITY, released.id(), vm.status(), released.status(), event);

        // Workloads cannot outlive their VM.
        SimulationKernel kernel = context.kernel();
        for (Workload workload : context.workloads().where(w -> w.isRunning() && w.vmId().equals(vm.id()))) {
            kernel.scheduleNow(workload.kind().stopTopic(),
                    new WorkloadChange(workload.id(), workload.vmId(), workload.deploymentId()));
        }
    }

    private void onIdle(SimEvent event) {
        VmIdle idle = event.payloadAs(VmIdle.class);
        VirtualMachine vm = context.vms().require(idle.vmId());
        boolean busy = !context.workloads().where(w -> w.isRunning() && w.vmId().equals(vm.id())).isEmpty();
        if (!vm.isAllocated() || vm.deployment().isPresent() || busy) {
            log.debug("VM {} no longer idle-releasable", vm.id());
            return;
        }
        log.debug("Releasing idle VM {}", vm.id());
        context.kernel().scheduleNow(StandardTopic.VM_DEALLOCATE, new VmDeallocation(vm.id()));
    }
}

package com.questrail.dcsim.core;

import com.questrail.dcsim.api.EventPayload.VmIdle;
import com.questrail.dcsim.api.EventPayload.WorkloadChange;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.StandardTopic;
import com.questrail.dcsim.kernel.InvariantViolation;
import com.questrail.dcsim.kernel.SimulationKernel;
import com.questrail.dcsim.model.VirtualMachine;
import com.questrail.dcsim.model.Workload;
import com.questrail.dcsim.model.WorkloadKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Start/stop bookkeeping for applications, containers and controllers.
 *
 * A start for an unknown workload registers it (stopped) and starts it. A start
 * requires the workload to be stopped and its VM to be allocated; a stop
 * requires it to be running on the VM the event names.
 *
 * <h2>Completion</h2>
 * A start carrying a length or an expiration schedules the workload's own
 * {@code *.stop}. That stop only applies to the run that scheduled it: once the
 * workload was stopped by someone else, its pending completion is dropped
 * when it fires.
 *
 * <h2>Idle VMs</h2>
 * With idle release enabled, a stop that leaves a request's VM without running
 * workloads schedules {@code vm.idle} for it. Deployment VMs are released by
 * the deployment manager.
 */
public final class WorkloadLifecycle
{
    private static final Logger log = LoggerFactory.getLogger(WorkloadLifecycle.class);

    static final String ENTITY = "workload";

    private final SimulationContext context;
    private final boolean releaseIdleVms;

    // sequence of every completion stop still queued, and the one owned by each workload's current run
    private final Set<Long> scheduledCompletions = new HashSet<>();
    private final Map<String, Long> currentCompletion = new HashMap<>();

    public WorkloadLifecycle(SimulationContext context, boolean releaseIdleVms) {
        this.context = Objects.requireNonNull(context, "context");
        this.releaseIdleVms = releaseIdleVms;
    }

    public WorkloadLifecycle(SimulationContext context) {
        this(context, false);
    }

    public void install() {
        SimulationKernel kernel = context.kernel();
        for (WorkloadKind kind : WorkloadKind.values()) {
            String name = "workload-lifecycle." + kind.name().toLowerCase();
            kernel.subscribe(kind.startTopic(), name + ".start", event -> onStart(kind, event));
            kernel.subscribe(kind.stopTopic(), name + ".stop", event -> onStop(kind, event));
        }
    }

    private void onStart(WorkloadKind kind, SimEvent event) {
        WorkloadChange change = event.payloadAs(WorkloadChange.class);
        VirtualMachine vm = context.vms().require(change.vmId());
        if (!vm.isAllocated()) {
            throw new InvariantViolation(kind + " " + change.workloadId() + " cannot start on vm "
                    + vm.id() + " in status " + vm.status());
        }

        Optional<Workload> known = context.workloads().find(change.workloadId());
        Workload workload = known.orElseGet(() ->
                Workload.registered(change.workloadId(), kind, change.vmId(), change.deploymentId()));
        if (workload.kind() != kind) {
            throw new InvariantViolation("workload " + workload.id() + " is a " + workload.kind() + ", not a " + kind);
        }
        Workload started = workload.start(change.vmId());

        if (known.isEmpty()) {
            context.workloads().create(started);
            context.recordTransition(ENTITY, started.id(), null, workload.status(), event);
        } else {
            context.workloads().put(started);
        }
        context.recordTransition(ENTITY, started.id(), workload.status(), started.status(), event);

        OptionalLong completion = change.completionTime(event.timestamp());
        if (completion.isPresent()) {
            SimEvent stop = context.kernel().schedule(kind.stopTopic(), completion.getAsLong(),
                    new WorkloadChange(started.id(), started.vmId(), started.deploymentId()));
            scheduledCompletions.add(stop.sequence());
            currentCompletion.put(started.id(), stop.sequence());
        }
    }

    private void onStop(WorkloadKind kind, SimEvent event) {
        WorkloadChange change = event.payloadAs(WorkloadChange.class);
        boolean completion = scheduledCompletions.remove(event.sequence());
        if (completion && !Long.valueOf(event.sequence()).equals(currentCompletion.get(change.workloadId()))) {
            log.debug("Dropping completion of {} from an earlier run", change.workloadId());
            return;
        }

        Workload workload = context.workloads().require(change.workloadId());
        if (workload.kind() != kind) {
            throw new InvariantViolation("workload " + workload.id() + " is a " + workload.kind() + ", not a " + kind);
        }
        if (!workload.vmId().equals(change.vmId())) {
            throw new InvariantViolation(kind + " " + workload.id() + " is not on vm " + change.vmId());
        }
        Workload stopped = context.workloads().put(workload.stop());
        currentCompletion.remove(stopped.id());
        context.recordTransition(ENTITY, stopped.id(), workload.status(), stopped.status(), event);

        if (releaseIdleVms && isIdleRequestVm(stopped.vmId())) {
            context.kernel().scheduleNow(StandardTopic.VM_IDLE, new VmIdle(stopped.vmId()));
        }
    }

    private boolean isIdleRequestVm(String vmId) {
        VirtualMachine vm = context.vms().require(vmId);
        return vm.isAllocated() && vm.deployment().isEmpty()
                && context.workloads().where(w -> w.isRunning() && w.vmId().equals(vmId)).isEmpty();
    }
}

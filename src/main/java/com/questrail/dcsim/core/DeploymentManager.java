package com.questrail.dcsim.core;

import com.questrail.dcsim.api.EventPayload.ApplyDeployment;
import com.questrail.dcsim.api.EventPayload.DeploymentTransition;
import com.questrail.dcsim.api.EventPayload.ScaleDeployment;
import com.questrail.dcsim.api.EventPayload.VmAllocation;
import com.questrail.dcsim.api.EventPayload.VmDeallocation;
import com.questrail.dcsim.api.EventPayload.WorkloadChange;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.StandardTopic;
import com.questrail.dcsim.kernel.InvariantViolation;
import com.questrail.dcsim.kernel.SimulationKernel;
import com.questrail.dcsim.model.Deployment;
import com.questrail.dcsim.model.DeploymentState;
import com.questrail.dcsim.model.VirtualMachine;
import com.questrail.dcsim.model.VmStatus;
import com.questrail.dcsim.model.Workload;
import com.questrail.dcsim.model.WorkloadKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * DeploymentManager
 * -----------------------------------------------------------------------------
 * Drives deployments towards their desired replica count and reports every
 * state boundary crossing on the matching {@code deployment.*} topic.
 *
 * <h2>Replicas</h2>
 * A replica is one container on its own VM. The manager never binds VMs
 * itself: it schedules {@code vm.allocate} like any other caller and reacts to
 * the outcome. The per-replica progress is local bookkeeping:
 * <pre>
 *   WAITING ──vm placed──► BOOTING ──container.start──► RUNNING
 *      │                      │                            │
 *      └──────── scale down ──┴────────────────────────────┴──► DRAINING ──► gone
 * </pre>
 * A replica VM that found no capacity stays WAITING and is retried, in
 * deployment order, whenever a {@code vm.deallocate} frees capacity.
 *
 * <h2>State evaluation</h2>
 * {@link #evaluate(int, int, boolean)} is the whole state table. Replica counts
 * alone cannot separate a scale-up in progress from a loss of replicas, so the
 * deployment carries an {@code operatorScaling} flag set by apply/scale
 * commands and cleared once the desired count is reached. A replica lost
 * without an operator command is not replaced until the operator scales again.
 *
 * <h2>Ordering</h2>
 * The manager subscribes after the VM and workload lifecycles, so it always
 * observes the committed outcome of an event. Sibling handlers keep running
 * after one of them failed, hence every reaction re-checks the arena instead
 * of trusting the event.
 */
public final class DeploymentManager
{
    private static final Logger log = LoggerFactory.getLogger(DeploymentManager.class);

    static final String ENTITY = "deployment";

    private final SimulationContext context;
    private final long replicaStartupDelay;

    private final Map<String, List<Replica>> replicas = new LinkedHashMap<>();

    public DeploymentManager(SimulationContext context, long replicaStartupDelay) {
        this.context = Objects.requireNonNull(context, "context");
        if (replicaStartupDelay < 0) {
            throw new IllegalArgumentException("replicaStartupDelay must be >= 0");
        }
        this.replicaStartupDelay = replicaStartupDelay;
    }

    public void install() {
        SimulationKernel kernel = context.kernel();
        kernel.subscribe(StandardTopic.CONTROLPLANE_APPLY, "deployment-manager.apply", this::onApply);
        kernel.subscribe(StandardTopic.CONTROLPLANE_SCALE, "deployment-manager.scale", this::onScale);
        kernel.subscribe(StandardTopic.VM_ALLOCATE, "deployment-manager.vm-allocated", this::onVmAllocated);
        kernel.subscribe(StandardTopic.VM_DEALLOCATE, "deployment-manager.vm-deallocated", this::onVmDeallocated);
        for (WorkloadKind kind : WorkloadKind.values()) {
            if (kind.countsAsReplica()) {
                kernel.subscribe(kind.startTopic(), "deployment-manager.replica-started", this::onReplicaStarted);
                kernel.subscribe(kind.stopTopic(), "deployment-manager.replica-stopped", this::onReplicaStopped);
            }
        }
    }

    /**
     * Deployment state for the given counts.
     *
     * @param operatorScaling whether the desired count was last changed by the
     *                        operator and has not been reached since
     */
    public static DeploymentState evaluate(int desired, int current, boolean operatorScaling) {
        if (desired == 0) {
            return DeploymentState.STOPPED;
        }
        if (current == desired) {
            return DeploymentState.RUNNING;
        }
        if (current == 0) {
            return DeploymentState.PENDING;
        }
        if (operatorScaling || current > desired) {
            return DeploymentState.SCALING;
        }
        return DeploymentState.DEGRADED;
    }

    /**
     * Ids of the replica VMs currently waiting for capacity.
     */
    public List<String> waitingReplicaVms(String deploymentId) {
        return replicasOf(deploymentId).stream()
                .filter(r -> r.phase == Phase.WAITING)
                .map(r -> r.vmId)
                .collect(Collectors.toList());
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    private void onApply(SimEvent event) {
        ApplyDeployment command = event.payloadAs(ApplyDeployment.class);
        if (context.deployments().contains(command.deploymentId())) {
            throw new InvariantViolation("duplicate deployment: " + command.deploymentId());
        }

        DeploymentState initial = evaluate(command.replicas(), 0, false);
        Deployment deployment = context.deployments().create(
                Deployment.submitted(command.deploymentId(), command.replicas(), command.replicaDemand(), initial));
        replicas.put(deployment.id(), new ArrayList<>());
        context.recordTransition(ENTITY, deployment.id(), null, initial, event);
        emitTransition(deployment, null);

        context.deployments().put(requestReplicas(deployment, command.replicas()));
    }

    private void onScale(SimEvent event) {
        ScaleDeployment command = event.payloadAs(ScaleDeployment.class);
        Deployment deployment = context.deployments().require(command.deploymentId());
        List<Replica> owned = replicasOf(deployment.id());

        Deployment rescaled = deployment.rescaled(command.replicas());
        int live = (int) owned.stream().filter(r -> r.phase != Phase.DRAINING).count();
        if (command.replicas() > live) {
            rescaled = requestReplicas(rescaled, command.replicas() - live);
        } else if (command.replicas() < live) {
            drain(rescaled, owned, live - command.replicas());
        }
        log.debug("Deployment {} scaled {} -> {}", deployment.id(), deployment.desiredReplicas(), command.replicas());

        reevaluate(context.deployments().put(rescaled), event);
    }

    // ---------------------------------------------------------------------
    // Reactions
    // ---------------------------------------------------------------------

    private void onVmAllocated(SimEvent event) {
        VmAllocation allocation = event.payloadAs(VmAllocation.class);
        Optional<Replica> match = allocation.deployment()
                .flatMap(deploymentId -> findReplica(deploymentId, r -> r.vmId.equals(allocation.vmId())));
        if (match.isEmpty() || !match.get().allocationInFlight) {
            return;
        }

        Replica replica = match.get();
        replica.allocationInFlight = false;
        boolean placed = context.vms().find(replica.vmId).map(VirtualMachine::isAllocated).orElse(false);
        SimulationKernel kernel = context.kernel();

        if (replica.phase == Phase.DRAINING) {
            if (placed) {
                kernel.scheduleNow(StandardTopic.VM_DEALLOCATE, new VmDeallocation(replica.vmId));
            }
            replicasOf(allocation.deploymentId()).remove(replica);
            return;
        }
        if (!placed) {
            log.debug("Replica VM {} waits for capacity", replica.vmId);
            return;
        }

        replica.phase = Phase.BOOTING;
        kernel.schedule(WorkloadKind.CONTAINER.startTopic(), kernel.now() + replicaStartupDelay,
                new WorkloadChange(replica.workloadId, replica.vmId, allocation.deploymentId()));
    }

    private void onReplicaStarted(SimEvent event) {
        WorkloadChange change = event.payloadAs(WorkloadChange.class);
        if (change.deployment().isEmpty()) {
            return;
        }
        Deployment deployment = context.deployments().require(change.deploymentId());

        boolean running = context.workloads().find(change.workloadId()).map(Workload::isRunning).orElse(false);
        Optional<Replica> match = findReplica(deployment.id(), r -> r.workloadId.equals(change.workloadId()));
        if (running && match.isPresent()) {
            Replica replica = match.get();
            if (replica.phase == Phase.DRAINING) {
                // Scaled away while booting.
                release(deployment, replica);
            } else {
                replica.phase = Phase.RUNNING;
            }
        }
        reevaluate(deployment, event);
    }

    private void onReplicaStopped(SimEvent event) {
        WorkloadChange change = event.payloadAs(WorkloadChange.class);
        if (change.deployment().isEmpty()) {
            return;
        }
        Deployment deployment = context.deployments().require(change.deploymentId());

        boolean running = context.workloads().find(change.workloadId()).map(Workload::isRunning).orElse(false);
        Optional<Replica> match = findReplica(deployment.id(), r -> r.workloadId.equals(change.workloadId()));
        if (!running && match.isPresent()) {
            Replica replica = match.get();
            replicasOf(deployment.id()).remove(replica);
            if (replica.phase != Phase.DRAINING) {
                log.debug("Deployment {} lost replica {}", deployment.id(), replica.workloadId);
                // The loss is now the last change, and the operator did not make it.
                deployment = context.deployments().put(deployment.withState(deployment.state(), false));
                boolean placed = context.vms().find(replica.vmId).map(VirtualMachine::isAllocated).orElse(false);
                if (placed) {
                    context.kernel().scheduleNow(StandardTopic.VM_DEALLOCATE, new VmDeallocation(replica.vmId));
                }
            }
        }
        reevaluate(deployment, event);
    }

    private void onVmDeallocated(SimEvent event) {
        VmDeallocation deallocation = event.payloadAs(VmDeallocation.class);

        // A booting replica whose VM went away will never start.
        context.vms().find(deallocation.vmId()).flatMap(VirtualMachine::deployment).ifPresent(deploymentId ->
                replicasOf(deploymentId).removeIf(r -> r.phase == Phase.BOOTING && r.vmId.equals(deallocation.vmId())));

        SimulationKernel kernel = context.kernel();
        for (Map.Entry<String, List<Replica>> entry : replicas.entrySet()) {
            Deployment deployment = context.deployments().require(entry.getKey());
            for (Replica replica : entry.getValue()) {
                if (replica.phase != Phase.WAITING || replica.allocationInFlight) {
                    continue;
                }
                boolean retryable = context.vms().find(replica.vmId)
                        .map(vm -> vm.status() == VmStatus.UNALLOCATED)
                        .orElse(true);
                if (retryable) {
                    replica.allocationInFlight = true;
                    kernel.scheduleNow(StandardTopic.VM_ALLOCATE,
                            new VmAllocation(replica.vmId, deployment.replicaDemand(), null, deployment.id()));
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private Deployment requestReplicas(Deployment deployment, int count) {
        List<Replica> owned = replicasOf(deployment.id());
        Deployment issued = deployment;
        for (int i = 0; i < count; i++) {
            int index = issued.replicasIssued();
            issued = issued.withReplicaIssued();
            Replica replica = new Replica(issued.replicaVmId(index), issued.replicaWorkloadId(index));
            replica.allocationInFlight = true;
            owned.add(replica);
            context.kernel().scheduleNow(StandardTopic.VM_ALLOCATE,
                    new VmAllocation(replica.vmId, issued.replicaDemand(), null, issued.id()));
        }
        return issued;
    }

    /**
     * Takes {@code count} replicas out of service, most recently requested first.
     */
    private void drain(Deployment deployment, List<Replica> owned, int count) {
        int remaining = count;
        for (int i = owned.size() - 1; i >= 0 && remaining > 0; i--) {
            Replica replica = owned.get(i);
            if (replica.phase == Phase.DRAINING) {
                continue;
            }
            remaining--;
            if (replica.phase == Phase.WAITING && !replica.allocationInFlight) {
                owned.remove(i);
            } else if (replica.phase == Phase.RUNNING) {
                release(deployment, replica);
            } else {
                // In flight or booting: finished when the pending event arrives.
                replica.phase = Phase.DRAINING;
            }
        }
    }

    private void release(Deployment deployment, Replica replica) {
        replica.phase = Phase.DRAINING;
        WorkloadKind kind = context.workloads().find(replica.workloadId)
                .map(Workload::kind)
                .orElse(WorkloadKind.CONTAINER);
        SimulationKernel kernel = context.kernel();
        kernel.scheduleNow(kind.stopTopic(), new WorkloadChange(replica.workloadId, replica.vmId, deployment.id()));
        kernel.scheduleNow(StandardTopic.VM_DEALLOCATE, new VmDeallocation(replica.vmId));
    }

    private void reevaluate(Deployment deployment, SimEvent cause) {
        int current = currentReplicas(deployment.id());
        DeploymentState next = evaluate(deployment.desiredReplicas(), current, deployment.operatorScaling());
        boolean stillScaling = deployment.operatorScaling()
                && next != DeploymentState.RUNNING && next != DeploymentState.STOPPED;

        Deployment updated = context.deployments().put(
                deployment.withCurrentReplicas(current).withState(next, stillScaling));
        if (next != deployment.state()) {
            context.recordTransition(ENTITY, updated.id(), deployment.state(), next, cause);
            emitTransition(updated, deployment.state());
        }
    }

    private int currentReplicas(String deploymentId) {
        Set<String> draining = replicasOf(deploymentId).stream()
                .filter(r -> r.phase == Phase.DRAINING)
                .map(r -> r.workloadId)
                .collect(Collectors.toSet());
        return (int) context.workloads().values().stream()
                .filter(w -> w.isRunningReplicaOf(deploymentId) && !draining.contains(w.id()))
                .count();
    }

    private void emitTransition(Deployment deployment, DeploymentState from) {
        log.debug("Deployment {} {} -> {} ({}/{})", deployment.id(), from, deployment.state(),
                deployment.currentReplicas(), deployment.desiredReplicas());
        context.kernel().scheduleNow(deployment.state().topic(), new DeploymentTransition(deployment.id(), from,
                deployment.state(), deployment.desiredReplicas(), deployment.currentReplicas(),
                deployment.previousDesiredReplicas()));
    }

    private List<Replica> replicasOf(String deploymentId) {
        return replicas.getOrDefault(deploymentId, Collections.emptyList());
    }

    private Optional<Replica> findReplica(String deploymentId, Predicate<Replica> filter) {
        return replicasOf(deploymentId).stream().filter(filter).findFirst();
    }

    private enum Phase
    {
        WAITING, BOOTING, RUNNING, DRAINING
    }

    private static final class Replica
    {
        final String vmId;
        final String workloadId;
        Phase phase = Phase.WAITING;
        boolean allocationInFlight;

        Replica(String vmId, String workloadId) {
            this.vmId = vmId;
            this.workloadId = workloadId;
        }
    }
}

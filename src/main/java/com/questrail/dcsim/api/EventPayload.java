package com.questrail.dcsim.api;

import com.questrail.dcsim.model.DeploymentState;
import com.questrail.dcsim.model.Resources;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * EventPayload
 * -----------------------------------------------------------------------------
 * Marker for the data carried by a {@link SimEvent}.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Payloads must be immutable</li>
 *   <li>Payloads reference entities by id, never by object</li>
 *   <li>Payloads carry only what the receiving handler needs</li>
 * </ul>
 *
 * The nested records are the payloads of the standard topics. Experiments
 * using {@link NamedTopic}s supply their own implementations.
 */
public interface EventPayload
{
    /** {@code request.arrive}: a request enters the system together with the VM that would serve it. */
    record RequestArrival(String requestId, String vmId, Resources demand,
                          boolean required, boolean ignored) implements EventPayload {
        public RequestArrival {
            Objects.requireNonNull(requestId, "requestId");
            Objects.requireNonNull(vmId, "vmId");
            Objects.requireNonNull(demand, "demand");
        }

        public static RequestArrival of(String requestId, String vmId, Resources demand) {
            return new RequestArrival(requestId, vmId, demand, false, false);
        }
    }

    /**
     * {@code request.accept} / {@code request.reject}. The reason is absent for
     * acceptances.
     */
    record RequestDecision(String requestId, String reason) implements EventPayload {
        public RequestDecision {
            Objects.requireNonNull(requestId, "requestId");
        }

        public static RequestDecision accepted(String requestId) {
            return new RequestDecision(requestId, null);
        }

        public static RequestDecision rejected(String requestId, String reason) {
            return new RequestDecision(requestId, Objects.requireNonNull(reason, "reason"));
        }

        public Optional<String> rejectionReason() {
            return Optional.ofNullable(reason);
        }
    }

    /** {@code request.stop}. */
    record RequestStop(String requestId) implements EventPayload {
        public RequestStop {
            Objects.requireNonNull(requestId, "requestId");
        }
    }

    /**
     * {@code vm.allocate}: place a VM on a host. The VM is registered with the
     * given demand if it is not yet known. At most one owner is set.
     */
    record VmAllocation(String vmId, Resources demand, String requestId, String deploymentId)
            implements EventPayload {
        public VmAllocation {
            Objects.requireNonNull(vmId, "vmId");
            Objects.requireNonNull(demand, "demand");
            if (requestId != null && deploymentId != null) {
                throw new IllegalArgumentException("a VM serves either a request or a deployment, not both");
            }
        }

        public static VmAllocation standalone(String vmId, Resources demand) {
            return new VmAllocation(vmId, demand, null, null);
        }

        public Optional<String> request() {
            return Optional.ofNullable(requestId);
        }

        public Optional<String> deployment() {
            return Optional.ofNullable(deploymentId);
        }
    }

    /** {@code vm.deallocate}. */
    record VmDeallocation(String vmId) implements EventPayload {
        public VmDeallocation {
            Objects.requireNonNull(vmId, "vmId");
        }
    }

    /**
     * {@code app.*}, {@code container.*}, {@code controller.*}: a workload
     * starts or stops on a VM, optionally as a replica of a deployment.
     *
     * <p>
     * On a start, {@code length} is the virtual time the workload needs to
     * finish and {@code expiration} the absolute time at which it is cut off.
     * Either one makes the workload stop on its own; without both it runs until
     * it is stopped. Both are ignored on a stop.
     * </p>
     */
    record WorkloadChange(String workloadId, String vmId, String deploymentId,
                          OptionalLong length, OptionalLong expiration) implements EventPayload {
        public WorkloadChange {
            Objects.requireNonNull(workloadId, "workloadId");
            Objects.requireNonNull(vmId, "vmId");
            Objects.requireNonNull(length, "length");
            Objects.requireNonNull(expiration, "expiration");
            if (length.isPresent() && length.getAsLong() < 0) {
                throw new IllegalArgumentException("length must be >= 0");
            }
        }

        public WorkloadChange(String workloadId, String vmId, String deploymentId) {
            this(workloadId, vmId, deploymentId, OptionalLong.empty(), OptionalLong.empty());
        }

        public static WorkloadChange onVm(String workloadId, String vmId) {
            return new WorkloadChange(workloadId, vmId, null);
        }

        public WorkloadChange withLength(long length) {
            return new WorkloadChange(workloadId, vmId, deploymentId, OptionalLong.of(length), expiration);
        }

        public WorkloadChange withExpiration(long expiration) {
            return new WorkloadChange(workloadId, vmId, deploymentId, length, OptionalLong.of(expiration));
        }

        public Optional<String> deployment() {
            return Optional.ofNullable(deploymentId);
        }

        /**
         * Time at which a workload started at {@code startedAt} stops on its
         * own: the earlier of completion and expiration, never before the start.
         */
        public OptionalLong completionTime(long startedAt) {
            if (length.isEmpty() && expiration.isEmpty()) {
                return OptionalLong.empty();
            }
            long finish = Long.MAX_VALUE;
            if (length.isPresent()) {
                finish = startedAt + length.getAsLong();
            }
            if (expiration.isPresent()) {
                finish = Math.min(finish, expiration.getAsLong());
            }
            return OptionalLong.of(Math.max(startedAt, finish));
        }
    }

    /**
     * {@code vm.idle}: the last workload on a VM stopped.
     */
    record VmIdle(String vmId) implements EventPayload {
        public VmIdle {
            Objects.requireNonNull(vmId, "vmId");
        }
    }

    /**
     * {@code deployment.*}: a deployment crossed a state boundary. {@code from}
     * is absent when the deployment was just created.
     */
    record DeploymentTransition(String deploymentId, DeploymentState from, DeploymentState to,
                                int desiredReplicas, int currentReplicas, int previousDesiredReplicas)
            implements EventPayload {
        public DeploymentTransition {
            Objects.requireNonNull(deploymentId, "deploymentId");
            Objects.requireNonNull(to, "to");
        }

        /** Replica delta of the last operator scale (± replicas). */
        public int delta() {
            return desiredReplicas - previousDesiredReplicas;
        }

        /** Replicas still missing to reach the desired count. */
        public int missingReplicas() {
            return Math.max(0, desiredReplicas - currentReplicas);
        }
    }

    /** {@code controlplane.apply}: submit a deployment. */
    record ApplyDeployment(String deploymentId, int replicas, Resources replicaDemand) implements EventPayload {
        public ApplyDeployment {
            Objects.requireNonNull(deploymentId, "deploymentId");
            Objects.requireNonNull(replicaDemand, "replicaDemand");
            if (replicas < 0) {
                throw new IllegalArgumentException("replicas must be >= 0");
            }
        }
    }

    /** {@code controlplane.scale}: the operator sets a new desired replica count. */
    record ScaleDeployment(String deploymentId, int replicas) implements EventPayload {
        public ScaleDeployment {
            Objects.requireNonNull(deploymentId, "deploymentId");
            if (replicas < 0) {
                throw new IllegalArgumentException("replicas must be >= 0");
            }
        }
    }

    /** {@code action.execute}: run one step of an action. */
    record ActionExecution(String actionId, int stepIndex) implements EventPayload {
        public ActionExecution {
            Objects.requireNonNull(actionId, "actionId");
            if (stepIndex < 0) {
                throw new IllegalArgumentException("stepIndex must be >= 0");
            }
        }
    }

    /** {@code sim.log}: free-form diagnostic record. */
    record LogMessage(String message) implements EventPayload {
        public LogMessage {
            Objects.requireNonNull(message, "message");
        }
    }
}

package com.questrail.dcsim.model;

import com.questrail.dcsim.kernel.InvariantViolation;

import java.util.Objects;
import java.util.Optional;

/**
 * An application, container or controller running on a VM.
 *
 * Start and stop strictly alternate: {@code start} is only valid from
 * {@link WorkloadStatus#STOPPED}, {@code stop} only from
 * {@link WorkloadStatus#RUNNING}.
 */
public record Workload(String id, WorkloadKind kind, String vmId, String deploymentId, WorkloadStatus status)
        implements Entity
{
    public Workload {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(vmId, "vmId");
        Objects.requireNonNull(status, "status");
    }

    public static Workload registered(String id, WorkloadKind kind, String vmId, String deploymentId) {
        return new Workload(id, kind, vmId, deploymentId, WorkloadStatus.STOPPED);
    }

    public Optional<String> deployment() {
        return Optional.ofNullable(deploymentId);
    }

    public boolean isRunning() {
        return status == WorkloadStatus.RUNNING;
    }

    /**
     * A running replica of the given deployment.
     */
    public boolean isRunningReplicaOf(String deployment) {
        return isRunning() && kind.countsAsReplica() && deployment.equals(deploymentId);
    }

    public Workload start(String onVm) {
        Objects.requireNonNull(onVm, "onVm");
        if (status != WorkloadStatus.STOPPED) {
            throw new InvariantViolation(kind + " " + id + " cannot start from " + status);
        }
        return new Workload(id, kind, onVm, deploymentId, WorkloadStatus.RUNNING);
    }

    public Workload stop() {
        if (status != WorkloadStatus.RUNNING) {
            throw new InvariantViolation(kind + " " + id + " cannot stop from " + status);
        }
        return new Workload(id, kind, vmId, deploymentId, WorkloadStatus.STOPPED);
    }
}

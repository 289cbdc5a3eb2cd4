package com.questrail.dcsim.model;

import java.util.Objects;

/**
 * Deployment
 * -----------------------------------------------------------------------------
 * Desired-replica abstraction over containers and controllers spread across
 * VMs.
 *
 * <p>
 * {@code operatorScaling} records that the last change of the desired count
 * came from the operator and has not been caught up yet. Replica counts alone
 * cannot tell a scale-up in progress from a loss of replicas; this flag is what
 * separates {@link DeploymentState#SCALING} from {@link DeploymentState#DEGRADED}.
 * </p>
 *
 * @param replicasIssued number of replica slots ever requested, used to name new ones
 */
public record Deployment(String id, int desiredReplicas, int previousDesiredReplicas, int currentReplicas,
                         DeploymentState state, boolean operatorScaling, Resources replicaDemand,
                         int replicasIssued) implements Entity
{
    public Deployment {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(replicaDemand, "replicaDemand");
        if (desiredReplicas < 0 || currentReplicas < 0) {
            throw new IllegalArgumentException("replica counts must be >= 0");
        }
    }

    /**
     * A freshly applied deployment. Its replicas are still to be brought up,
     * which counts as an operator-initiated change.
     */
    public static Deployment submitted(String id, int desiredReplicas, Resources replicaDemand, DeploymentState state) {
        return new Deployment(id, desiredReplicas, 0, 0, state, desiredReplicas > 0, replicaDemand, 0);
    }

    /**
     * Operator-initiated change of the desired count.
     */
    public Deployment rescaled(int desired) {
        return new Deployment(id, desired, desiredReplicas, currentReplicas, state, true, replicaDemand, replicasIssued);
    }

    public Deployment withCurrentReplicas(int current) {
        return new Deployment(id, desiredReplicas, previousDesiredReplicas, current, state, operatorScaling,
                replicaDemand, replicasIssued);
    }

    public Deployment withState(DeploymentState next, boolean stillScaling) {
        return new Deployment(id, desiredReplicas, previousDesiredReplicas, currentReplicas, next, stillScaling,
                replicaDemand, replicasIssued);
    }

    /**
     * Reserves the next replica index.
     */
    public Deployment withReplicaIssued() {
        return new Deployment(id, desiredReplicas, previousDesiredReplicas, currentReplicas, state, operatorScaling,
                replicaDemand, replicasIssued + 1);
    }

    public String replicaVmId(int index) {
        return id + "-vm-" + index;
    }

    public String replicaWorkloadId(int index) {
        return id + "-c-" + index;
    }
}

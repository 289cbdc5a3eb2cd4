package com.questrail.dcsim.model;

import com.questrail.dcsim.api.StandardTopic;

/**
 * Lifecycle state of a deployment, with the notification topic fired when a
 * deployment enters it.
 */
public enum DeploymentState
{
    /** No replica running yet, replicas wanted. */
    PENDING(StandardTopic.DEPLOYMENT_PEND),

    /** Replica count matches the desired count. */
    RUNNING(StandardTopic.DEPLOYMENT_RUN),

    /** Replicas were lost; fewer running than desired. */
    DEGRADED(StandardTopic.DEPLOYMENT_DEGRADE),

    /** The operator changed the desired count and replicas have not caught up. */
    SCALING(StandardTopic.DEPLOYMENT_SCALE),

    /** Desired count is zero. Reopened by a later scale-up. */
    STOPPED(StandardTopic.DEPLOYMENT_STOP);

    private final StandardTopic topic;

    DeploymentState(StandardTopic topic) {
        this.topic = topic;
    }

    public StandardTopic topic() {
        return topic;
    }
}

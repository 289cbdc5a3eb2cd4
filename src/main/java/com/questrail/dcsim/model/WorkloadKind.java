package com.questrail.dcsim.model;

import com.questrail.dcsim.api.StandardTopic;

/**
 * Kinds of workload a VM runs, with the topics that start and stop them.
 */
public enum WorkloadKind
{
    APPLICATION(StandardTopic.APP_START, StandardTopic.APP_STOP),
    CONTAINER(StandardTopic.CONTAINER_START, StandardTopic.CONTAINER_STOP),
    CONTROLLER(StandardTopic.CONTROLLER_START, StandardTopic.CONTROLLER_STOP);

    private final StandardTopic startTopic;
    private final StandardTopic stopTopic;

    WorkloadKind(StandardTopic startTopic, StandardTopic stopTopic) {
        this.startTopic = startTopic;
        this.stopTopic = stopTopic;
    }

    public StandardTopic startTopic() {
        return startTopic;
    }

    public StandardTopic stopTopic() {
        return stopTopic;
    }

    /**
     * Containers and controllers bound to a deployment count as its replicas.
     */
    public boolean countsAsReplica() {
        return this != APPLICATION;
    }
}

package com.questrail.dcsim.config;

import com.questrail.dcsim.kernel.RunLimits;

import java.util.Objects;

/**
 * Aggregated configuration for a simulation run.
 *
 * @param name                 run name, used as the log prefix and in reports
 * @param runLimits            limits applied by {@code run()} when none are given
 * @param replicaStartupDelay  virtual time between a replica VM being allocated
 *                             and its container starting
 * @param logEvents            log every dispatched event and entity transition
 *                             through SLF4J
 * @param releaseIdleVms       deallocate a request's VM once its last workload
 *                             stopped
 */
public record SimulationConfig(
    String name,
    RunLimits runLimits,
    long replicaStartupDelay,
    boolean logEvents,
    boolean releaseIdleVms
) {
    public SimulationConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(runLimits, "runLimits");
        if (replicaStartupDelay < 0) {
            throw new IllegalArgumentException("replicaStartupDelay must be >= 0");
        }
    }

    public static SimulationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name = "dcsim";
        private RunLimits runLimits = RunLimits.unbounded();
        private long replicaStartupDelay = 0;
        private boolean logEvents = true;
        private boolean releaseIdleVms = false;

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withRunLimits(RunLimits runLimits) {
            this.runLimits = runLimits;
            return this;
        }

        public Builder withReplicaStartupDelay(long replicaStartupDelay) {
            this.replicaStartupDelay = replicaStartupDelay;
            return this;
        }

        public Builder withLogEvents(boolean logEvents) {
            this.logEvents = logEvents;
            return this;
        }

        public Builder withReleaseIdleVms(boolean releaseIdleVms) {
            this.releaseIdleVms = releaseIdleVms;
            return this;
        }

        public SimulationConfig build() {
            return new SimulationConfig(name, runLimits, replicaStartupDelay, logEvents, releaseIdleVms);
        }
    }
}

package com.questrail.dcsim.report;

import com.questrail.dcsim.api.KernelState;
import com.questrail.dcsim.kernel.Fault;
import com.questrail.dcsim.kernel.FaultKind;

import java.util.List;
import java.util.Objects;

/**
 * Read-only summary of a run, available in every terminal kernel state.
 *
 * @param name              run name
 * @param state             kernel state when the report was taken
 * @param finalTime         virtual time of the last dispatched event
 * @param eventsDispatched  events dispatched over all runs of the kernel
 * @param faults            every fault recorded, in order
 * @param admission         admission counters
 */
public record RunReport(String name, KernelState state, long finalTime, long eventsDispatched,
                        List<Fault> faults, AdmissionTracker admission)
{
    public RunReport {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(admission, "admission");
        faults = List.copyOf(Objects.requireNonNull(faults, "faults"));
    }

    public long faultCount(FaultKind kind) {
        return faults.stream().filter(f -> f.kind() == kind).count();
    }

    /**
     * Multi-line summary in the log format of the run.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append('@').append(finalTime).append("> ").append(state)
          .append(" after ").append(eventsDispatched).append(" events\n");
        sb.append(name).append('@').append(finalTime).append("> requests=").append(admission.requests())
          .append(" accepted=").append(admission.accepted()).append(" (").append(admission.acceptRate()).append(')')
          .append(" rejected=").append(admission.rejected()).append(" (").append(admission.rejectRate()).append(')');
        for (FaultKind kind : FaultKind.values()) {
            long count = faultCount(kind);
            if (count > 0) {
                sb.append('\n').append(name).append('@').append(finalTime).append("> ")
                  .append(kind).append(" faults=").append(count);
            }
        }
        return sb.toString();
    }
}

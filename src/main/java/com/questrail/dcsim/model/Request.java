package com.questrail.dcsim.model;

import com.questrail.dcsim.kernel.InvariantViolation;

import java.util.Objects;
import java.util.Optional;

/**
 * Request
 * -----------------------------------------------------------------------------
 * A demand for one VM entering the system.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   ARRIVED → ACCEPTED → STOPPED
 *          ↘ REJECTED
 * </pre>
 * The admission decision is applied exactly once; a second decision is an
 * {@link InvariantViolation}, never silently ignored.
 *
 * <p>
 * {@code required} requests must never be rejected (used for the initial
 * infrastructure of a scenario). {@code ignored} requests run normally but do
 * not count in admission statistics.
 * </p>
 */
public record Request(String id, long arrivalTime, Resources demand, String vmId, RequestStatus status,
                      boolean required, boolean ignored, String rejectReason) implements Entity
{
    public Request {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(demand, "demand");
        Objects.requireNonNull(vmId, "vmId");
        Objects.requireNonNull(status, "status");
    }

    public static Request arrived(String id, long arrivalTime, Resources demand, String vmId,
                                  boolean required, boolean ignored) {
        return new Request(id, arrivalTime, demand, vmId, RequestStatus.ARRIVED, required, ignored, null);
    }

    public Optional<String> rejection() {
        return Optional.ofNullable(rejectReason);
    }

    public Request accept() {
        requireUndecided("accept");
        return new Request(id, arrivalTime, demand, vmId, RequestStatus.ACCEPTED, required, ignored, null);
    }

    public Request reject(String reason) {
        Objects.requireNonNull(reason, "reason");
        requireUndecided("reject");
        return new Request(id, arrivalTime, demand, vmId, RequestStatus.REJECTED, required, ignored, reason);
    }

    public Request stop() {
        if (status != RequestStatus.ACCEPTED) {
            throw new InvariantViolation("request " + id + " cannot stop from " + status);
        }
        return new Request(id, arrivalTime, demand, vmId, RequestStatus.STOPPED, required, ignored, null);
    }

    private void requireUndecided(String decision) {
        if (status.isDecided()) {
            throw new InvariantViolation("request " + id + " already " + status + ", refusing to " + decision);
        }
    }
}

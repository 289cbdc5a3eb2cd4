package com.questrail.dcsim.kernel;

import java.util.Objects;

/**
 * Record of a fault encountered during a run.
 *
 * @param kind    classification
 * @param time    virtual time at which the fault was observed
 * @param source  subscriber name or kernel component that raised it
 * @param message human-readable description
 * @param cause   underlying exception, may be {@code null}
 */
public record Fault(FaultKind kind, long time, String source, String message, Throwable cause)
{
    public Fault {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return kind + "@" + time + " [" + source + "] " + message;
    }
}

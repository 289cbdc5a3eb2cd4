package com.questrail.dcsim.kernel;

/**
 * An entity mutation would break a model invariant.
 *
 * This typically reflects:
 * <ul>
 *   <li>a host allocation beyond its capacity</li>
 *   <li>a second admission decision for a request</li>
 *   <li>a lifecycle transition from an invalid source state</li>
 * </ul>
 *
 * Entities throw this before mutating anything, so the entity stays in its last
 * valid state.
 */
public final class InvariantViolation extends SimulationException
{
    public InvariantViolation(String message) {
        super(message);
    }

    @Override
    public FaultKind kind() {
        return FaultKind.INVARIANT_VIOLATION;
    }
}

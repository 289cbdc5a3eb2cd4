package com.questrail.dcsim.model;

import com.questrail.dcsim.kernel.InvariantViolation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * PhysicalMachine
 * -----------------------------------------------------------------------------
 * A host with fixed capacity and the VMs bound to it.
 *
 * <h2>Binding invariant</h2>
 * {@code allocated} never exceeds {@code capacity} in any dimension. This is
 * enforced here, by the bookkeeping, regardless of which placement policy
 * chose the host: an allocation that would overcommit fails with an
 * {@link InvariantViolation} and produces no new value.
 */
public record PhysicalMachine(String id, Resources capacity, Resources allocated, Set<String> hostedVmIds)
        implements Entity
{
    public PhysicalMachine {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(capacity, "capacity");
        Objects.requireNonNull(allocated, "allocated");
        if (!allocated.fitsWithin(capacity)) {
            throw new InvariantViolation("pm " + id + " allocated " + allocated + " exceeds capacity " + capacity);
        }
        hostedVmIds = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(hostedVmIds, "hostedVmIds")));
    }

    /**
     * An empty host.
     */
    public static PhysicalMachine of(String id, Resources capacity) {
        return new PhysicalMachine(id, capacity, Resources.ZERO, Set.of());
    }

    public Resources free() {
        return capacity.minus(allocated);
    }

    public boolean canHost(Resources demand) {
        return demand.fitsWithin(free());
    }

    public boolean hosts(String vmId) {
        return hostedVmIds.contains(vmId);
    }

    /**
     * Returns this host with the VM bound to it.
     *
     * @throws InvariantViolation if the VM is already hosted or does not fit
     */
    public PhysicalMachine allocate(String vmId, Resources demand) {
        Objects.requireNonNull(vmId, "vmId");
        Objects.requireNonNull(demand, "demand");
        if (hostedVmIds.contains(vmId)) {
            throw new InvariantViolation("vm " + vmId + " already hosted on pm " + id);
        }
        if (!canHost(demand)) {
            throw new InvariantViolation("pm " + id + " cannot host vm " + vmId + ": demand " + demand
                    + " exceeds free " + free());
        }
        Set<String> hosted = new LinkedHashSet<>(hostedVmIds);
        hosted.add(vmId);
        return new PhysicalMachine(id, capacity, allocated.plus(demand), hosted);
    }

    /**
     * Returns this host with the VM unbound and its demand released.
     *
     * @throws InvariantViolation if the VM is not hosted here
     */
    public PhysicalMachine release(String vmId, Resources demand) {
        Objects.requireNonNull(vmId, "vmId");
        Objects.requireNonNull(demand, "demand");
        if (!hostedVmIds.contains(vmId)) {
            throw new InvariantViolation("vm " + vmId + " is not hosted on pm " + id);
        }
        Set<String> hosted = new LinkedHashSet<>(hostedVmIds);
        hosted.remove(vmId);
        return new PhysicalMachine(id, capacity, allocated.minus(demand), hosted);
    }
}

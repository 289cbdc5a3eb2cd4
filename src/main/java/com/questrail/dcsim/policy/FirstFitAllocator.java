package com.questrail.dcsim.policy;

import com.questrail.dcsim.model.PhysicalMachine;
import com.questrail.dcsim.model.Resources;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Places a VM on the first host, in pool order, with enough free capacity.
 */
public final class FirstFitAllocator implements Allocator
{
    @Override
    public Optional<String> selectPm(Resources demand, Collection<PhysicalMachine> pool) {
        Objects.requireNonNull(demand, "demand");
        for (PhysicalMachine pm : pool) {
            if (pm.canHost(demand)) {
                return Optional.of(pm.id());
            }
        }
        return Optional.empty();
    }
}

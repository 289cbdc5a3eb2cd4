package com.questrail.dcsim.policy;

import com.questrail.dcsim.model.PhysicalMachine;
import com.questrail.dcsim.model.Resources;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cycles through the pool, starting after the host chosen last, and places the
 * VM on the first host that fits.
 *
 * Stateful: one instance per simulation.
 */
public final class RoundRobinAllocator implements Allocator
{
    private int lastHostIndex = -1;

    @Override
    public Optional<String> selectPm(Resources demand, Collection<PhysicalMachine> pool) {
        Objects.requireNonNull(demand, "demand");
        List<PhysicalMachine> hosts = List.copyOf(pool);
        int maxTries = hosts.size();

        for (int i = 1; i <= maxTries; i++) {
            int index = Math.floorMod(lastHostIndex + i, maxTries);
            PhysicalMachine host = hosts.get(index);
            if (host.canHost(demand)) {
                lastHostIndex = index;
                return Optional.of(host.id());
            }
        }
        return Optional.empty();
    }
}

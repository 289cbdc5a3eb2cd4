package com.questrail.dcsim.policy;

import com.questrail.dcsim.model.PhysicalMachine;
import com.questrail.dcsim.model.Resources;

import java.util.Collection;
import java.util.Optional;

/**
 * Allocator
 * -----------------------------------------------------------------------------
 * Pluggable VM placement policy.
 *
 * <p>
 * Given a VM's demand and the host pool (in pool order), returns the id of the
 * host to place it on, or empty when the policy finds no capacity. The policy
 * only decides; the kernel's bookkeeping commits the placement and refuses any
 * choice that would overcommit the host, whatever the policy returned.
 * </p>
 */
@FunctionalInterface
public interface Allocator
{
    Optional<String> selectPm(Resources demand, Collection<PhysicalMachine> pool);
}

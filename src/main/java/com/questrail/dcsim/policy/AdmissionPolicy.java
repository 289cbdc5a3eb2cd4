package com.questrail.dcsim.policy;

import com.questrail.dcsim.model.PhysicalMachine;
import com.questrail.dcsim.model.Request;

import java.util.Collection;
import java.util.Optional;

/**
 * Admission check applied when a request arrives, before placement is tried.
 *
 * Returning a reason rejects the request outright; returning empty passes it on
 * to VM placement, whose outcome then decides acceptance.
 */
@FunctionalInterface
public interface AdmissionPolicy
{
    Optional<String> rejectionReason(Request request, Collection<PhysicalMachine> pool);

    /**
     * Lets every request through to placement.
     */
    static AdmissionPolicy admitAll() {
        return (request, pool) -> Optional.empty();
    }
}

package com.questrail.dcsim.model;

import com.questrail.dcsim.kernel.InvariantViolation;

import java.util.Objects;
import java.util.Optional;

/**
 * A resource-demanding unit placed on exactly one host.
 *
 * A VM is created unallocated, bound once by {@code vm.allocate} and unbound
 * once by {@code vm.deallocate}; {@link VmStatus#DEALLOCATED} is terminal. The
 * owner (a request or a deployment) is recorded by id only.
 */
public record VirtualMachine(String id, Resources demand, String hostPmId, VmStatus status,
                             String requestId, String deploymentId) implements Entity
{
    public VirtualMachine {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(demand, "demand");
        Objects.requireNonNull(status, "status");
        if ((status == VmStatus.ALLOCATED) != (hostPmId != null)) {
            throw new IllegalArgumentException("vm " + id + " has host " + hostPmId + " in status " + status);
        }
    }

    public static VirtualMachine unallocated(String id, Resources demand, String requestId, String deploymentId) {
        return new VirtualMachine(id, demand, null, VmStatus.UNALLOCATED, requestId, deploymentId);
    }

    public Optional<String> host() {
        return Optional.ofNullable(hostPmId);
    }

    public Optional<String> request() {
        return Optional.ofNullable(requestId);
    }

    public Optional<String> deployment() {
        return Optional.ofNullable(deploymentId);
    }

    public boolean isAllocated() {
        return status == VmStatus.ALLOCATED;
    }

    public VirtualMachine allocatedOn(String pmId) {
        Objects.requireNonNull(pmId, "pmId");
        if (status != VmStatus.UNALLOCATED) {
            throw new InvariantViolation("vm " + id + " cannot be allocated from " + status);
        }
        return new VirtualMachine(id, demand, pmId, VmStatus.ALLOCATED, requestId, deploymentId);
    }

    public VirtualMachine deallocated() {
        if (status != VmStatus.ALLOCATED) {
            throw new InvariantViolation("vm " + id + " cannot be deallocated from " + status);
        }
        return new VirtualMachine(id, demand, null, VmStatus.DEALLOCATED, requestId, deploymentId);
    }
}

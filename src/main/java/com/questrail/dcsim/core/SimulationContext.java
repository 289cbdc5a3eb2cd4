package com.questrail.dcsim.core;

import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.kernel.SimulationKernel;
import com.questrail.dcsim.model.Action;
import com.questrail.dcsim.model.Deployment;
import com.questrail.dcsim.model.EntityArena;
import com.questrail.dcsim.model.PhysicalMachine;
import com.questrail.dcsim.model.Request;
import com.questrail.dcsim.model.VirtualMachine;
import com.questrail.dcsim.model.Workload;
import com.questrail.dcsim.observability.EntityTransitionEvent;
import com.questrail.dcsim.observability.NullObservabilitySink;
import com.questrail.dcsim.observability.SimulationObservabilitySink;

import java.util.Objects;

/**
 * SimulationContext
 * -----------------------------------------------------------------------------
 * Everything one simulation run owns: the kernel and the entity arenas.
 *
 * <h2>No global state</h2>
 * Handlers receive the context explicitly; nothing is process-wide. Several
 * independent simulations can therefore live in the same JVM, for example in a
 * parameter sweep.
 *
 * <h2>Mutation discipline</h2>
 * Arenas are mutated only from handlers dispatched by the kernel (and during
 * scenario setup before the first run). The kernel never runs two handlers at
 * once, so no locking is needed.
 */
public final class SimulationContext
{
    private final SimulationKernel kernel;
    private final SimulationObservabilitySink observabilitySink;

    private final EntityArena<PhysicalMachine> hosts = new EntityArena<>("pm");
    private final EntityArena<VirtualMachine> vms = new EntityArena<>("vm");
    private final EntityArena<Request> requests = new EntityArena<>("request");
    private final EntityArena<Deployment> deployments = new EntityArena<>("deployment");
    private final EntityArena<Workload> workloads = new EntityArena<>("workload");
    private final EntityArena<Action> actions = new EntityArena<>("action");

    public SimulationContext(SimulationKernel kernel, SimulationObservabilitySink observabilitySink) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public SimulationKernel kernel() {
        return kernel;
    }

    public EntityArena<PhysicalMachine> hosts() {
        return hosts;
    }

    public EntityArena<VirtualMachine> vms() {
        return vms;
    }

    public EntityArena<Request> requests() {
        return requests;
    }

    public EntityArena<Deployment> deployments() {
        return deployments;
    }

    public EntityArena<Workload> workloads() {
        return workloads;
    }

    public EntityArena<Action> actions() {
        return actions;
    }

    /**
     * Reports a committed status change to the observability sink. Calls where
     * the status did not change are ignored.
     */
    void recordTransition(String entityKind, String entityId, Enum<?> from, Enum<?> to, SimEvent cause) {
        if (from == to) {
            return;
        }
        observabilitySink.onEntityTransition(
                new EntityTransitionEvent(kernel.now(), entityKind, entityId, from, to, cause.topic()));
    }
}

package com.questrail.dcsim.core;

import com.questrail.dcsim.api.EventPayload.RequestArrival;
import com.questrail.dcsim.api.EventPayload.RequestDecision;
import com.questrail.dcsim.api.EventPayload.RequestStop;
import com.questrail.dcsim.api.EventPayload.VmAllocation;
import com.questrail.dcsim.api.EventPayload.VmDeallocation;
import com.questrail.dcsim.api.EventPayload.WorkloadChange;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.StandardTopic;
import com.questrail.dcsim.kernel.InvariantViolation;
import com.questrail.dcsim.kernel.KernelFault;
import com.questrail.dcsim.kernel.SimulationKernel;
import com.questrail.dcsim.model.Request;
import com.questrail.dcsim.model.VirtualMachine;
import com.questrail.dcsim.model.Workload;
import com.questrail.dcsim.policy.AdmissionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * RequestLifecycle
 * -----------------------------------------------------------------------------
 * Admission control: reacts to the {@code request.*} topics.
 *
 * <h2>Flow</h2>
 * <pre>
 *   request.arrive ──► admission policy ──refused──► request.reject
 *                           │
 *                           └──► vm.allocate ──placed──► request.accept
 *                                            └─no host─► request.reject
 *   request.stop   ──► *.stop for workloads on the VM, then vm.deallocate
 * </pre>
 *
 * The decision handlers apply the decision exactly once. A second decision for
 * the same request surfaces as an {@link InvariantViolation}.
 */
public final class RequestLifecycle
{
    private static final Logger log = LoggerFactory.getLogger(RequestLifecycle.class);

    static final String ENTITY = "request";

    private final SimulationContext context;
    private final AdmissionPolicy admissionPolicy;

    public RequestLifecycle(SimulationContext context, AdmissionPolicy admissionPolicy) {
        this.context = Objects.requireNonNull(context, "context");
        this.admissionPolicy = Objects.requireNonNull(admissionPolicy, "admissionPolicy");
    }

    public void install() {
        SimulationKernel kernel = context.kernel();
        kernel.subscribe(StandardTopic.REQUEST_ARRIVE, "request-lifecycle.arrive", this::onArrive);
        kernel.subscribe(StandardTopic.REQUEST_ACCEPT, "request-lifecycle.accept", this::onAccept);
        kernel.subscribe(StandardTopic.REQUEST_REJECT, "request-lifecycle.reject", this::onReject);
        kernel.subscribe(StandardTopic.REQUEST_STOP, "request-lifecycle.stop", this::onStop);
    }

    private void onArrive(SimEvent event) {
        RequestArrival arrival = event.payloadAs(RequestArrival.class);
        if (context.requests().contains(arrival.requestId())) {
            throw new InvariantViolation("duplicate request: " + arrival.requestId());
        }
        if (context.vms().contains(arrival.vmId())) {
            throw new InvariantViolation("request " + arrival.requestId() + " names existing vm " + arrival.vmId());
        }

        Request request = Request.arrived(arrival.requestId(), event.timestamp(),
                arrival.demand(), arrival.vmId(), arrival.required(), arrival.ignored());
        VirtualMachine vm = VirtualMachine.unallocated(arrival.vmId(), arrival.demand(), arrival.requestId(), null);
        Optional<String> refusal = admissionPolicy.rejectionReason(request, context.hosts().values());

        context.requests().create(request);
        context.vms().create(vm);
        context.recordTransition(ENTITY, request.id(), null, request.status(), event);
        context.recordTransition(VmLifecycle.ENTITY, vm.id(), null, vm.status(), event);

        SimulationKernel kernel = context.kernel();
        if (refusal.isPresent()) {
            log.debug("Request {} refused by admission policy: {}", request.id(), refusal.get());
            kernel.scheduleNow(StandardTopic.REQUEST_REJECT, RequestDecision.rejected(request.id(), refusal.get()));
            return;
        }
        kernel.scheduleNow(StandardTopic.VM_ALLOCATE,
                new VmAllocation(vm.id(), vm.demand(), request.id(), null));
    }

    private void onAccept(SimEvent event) {
        RequestDecision decision = event.payloadAs(RequestDecision.class);
        Request request = context.requests().require(decision.requestId());
        Request accepted = context.requests().put(request.accept());
        context.recordTransition(ENTITY, accepted.id(), request.status(), accepted.status(), event);
    }

    private void onReject(SimEvent event) {
        RequestDecision decision = event.payloadAs(RequestDecision.class);
        Request request = context.requests().require(decision.requestId());
        Request rejected = context.requests().put(
                request.reject(decision.rejectionReason().orElse("unspecified")));
        context.recordTransition(ENTITY, rejected.id(), request.status(), rejected.status(), event);

        if (rejected.required()) {
            throw new KernelFault("required request " + rejected.id() + " was rejected: "
                    + rejected.rejection().orElse("unspecified"));
        }
    }

    private void onStop(SimEvent event) {
        RequestStop stop = event.payloadAs(RequestStop.class);
        Request request = context.requests().require(stop.requestId());
        Request stopped = context.requests().put(request.stop());
        context.recordTransition(ENTITY, stopped.id(), request.status(), stopped.status(), event);

        // Release what the request holds: workloads first, then the VM.
        SimulationKernel kernel = context.kernel();
        for (Workload workload : context.workloads().where(w -> w.isRunning() && w.vmId().equals(stopped.vmId()))) {
            kernel.scheduleNow(workload.kind().stopTopic(),
                    new WorkloadChange(workload.id(), workload.vmId(), workload.deploymentId()));
        }
        if (context.vms().require(stopped.vmId()).isAllocated()) {
            kernel.scheduleNow(StandardTopic.VM_DEALLOCATE, new VmDeallocation(stopped.vmId()));
        }
    }
}

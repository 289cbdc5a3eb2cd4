package com.questrail.dcsim;

import com.questrail.dcsim.api.EventPayload.ApplyDeployment;
import com.questrail.dcsim.api.EventPayload.RequestArrival;
import com.questrail.dcsim.api.EventPayload.RequestStop;
import com.questrail.dcsim.api.EventPayload.ScaleDeployment;
import com.questrail.dcsim.api.KernelState;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.StandardTopic;
import com.questrail.dcsim.config.SimulationConfig;
import com.questrail.dcsim.core.ActionExecutor;
import com.questrail.dcsim.core.DeploymentManager;
import com.questrail.dcsim.core.RequestLifecycle;
import com.questrail.dcsim.core.SimLogWriter;
import com.questrail.dcsim.core.SimulationContext;
import com.questrail.dcsim.core.VmLifecycle;
import com.questrail.dcsim.core.WorkloadLifecycle;
import com.questrail.dcsim.kernel.RunLimits;
import com.questrail.dcsim.kernel.SimulationKernel;
import com.questrail.dcsim.model.Action;
import com.questrail.dcsim.model.PhysicalMachine;
import com.questrail.dcsim.model.Resources;
import com.questrail.dcsim.observability.NullObservabilitySink;
import com.questrail.dcsim.observability.SimulationObservabilitySink;
import com.questrail.dcsim.observability.Slf4jSimulationObservabilitySink;
import com.questrail.dcsim.policy.ActionInterpreter;
import com.questrail.dcsim.policy.AdmissionPolicy;
import com.questrail.dcsim.policy.Allocator;
import com.questrail.dcsim.policy.EmittingActionInterpreter;
import com.questrail.dcsim.policy.FirstFitAllocator;
import com.questrail.dcsim.report.AdmissionTracker;
import com.questrail.dcsim.report.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CloudSimulation
 * =============================================================================
 * Composition root and lifecycle owner for one data-center simulation.
 *
 * <h2>Wiring</h2>
 * Builds a {@link SimulationKernel} and a {@link SimulationContext}, registers
 * the hosts, and installs the built-in handlers in a fixed order:
 * <ol>
 *   <li>{@link RequestLifecycle}</li>
 *   <li>{@link VmLifecycle}</li>
 *   <li>{@link WorkloadLifecycle}</li>
 *   <li>{@link ActionExecutor}</li>
 *   <li>{@link DeploymentManager}</li>
 *   <li>{@link SimLogWriter}</li>
 * </ol>
 * Handlers on the same topic run in that order, so the deployment manager
 * always sees the outcome committed by the lifecycles.
 *
 * <h2>Scenario input</h2>
 * The {@code arrive}, {@code apply}, {@code scale}, {@code stopRequest} and
 * {@code submit} methods only schedule events; nothing happens until
 * {@link #run()}. Custom subscribers and custom topics go through
 * {@link #kernel()} directly.
 */
public final class CloudSimulation
{
    private static final Logger log = LoggerFactory.getLogger(CloudSimulation.class);

    private final SimulationConfig config;
    private final SimulationKernel kernel;
    private final SimulationContext context;
    private final ActionExecutor actionExecutor;
    private final DeploymentManager deploymentManager;

    private CloudSimulation(Builder builder) {
        this.config = builder.config;

        SimulationObservabilitySink sink = builder.observabilitySink != null
                ? builder.observabilitySink
                : config.logEvents() ? new Slf4jSimulationObservabilitySink(config.name()) : NullObservabilitySink.INSTANCE;

        this.kernel = new SimulationKernel(sink);
        this.context = new SimulationContext(kernel, sink);
        for (PhysicalMachine host : builder.hosts) {
            context.hosts().create(host);
        }

        new RequestLifecycle(context, builder.admissionPolicy).install();
        new VmLifecycle(context, builder.allocator).install();
        new WorkloadLifecycle(context, config.releaseIdleVms()).install();
        this.actionExecutor = new ActionExecutor(context, builder.interpreter);
        actionExecutor.install();
        this.deploymentManager = new DeploymentManager(context, config.replicaStartupDelay());
        deploymentManager.install();
        new SimLogWriter(config.name()).install(kernel);

        log.debug("Simulation {} wired with {} hosts, allocator {}", config.name(), builder.hosts.size(),
                builder.allocator.getClass().getSimpleName());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Scenario input
    // ---------------------------------------------------------------------

    public SimEvent arrive(long at, RequestArrival arrival) {
        return kernel.schedule(StandardTopic.REQUEST_ARRIVE, at, arrival);
    }

    public SimEvent stopRequest(long at, String requestId) {
        return kernel.schedule(StandardTopic.REQUEST_STOP, at, new RequestStop(requestId));
    }

    public SimEvent apply(long at, String deploymentId, int replicas, Resources replicaDemand) {
        return kernel.schedule(StandardTopic.CONTROLPLANE_APPLY, at,
                new ApplyDeployment(deploymentId, replicas, replicaDemand));
    }

    public SimEvent scale(long at, String deploymentId, int replicas) {
        return kernel.schedule(StandardTopic.CONTROLPLANE_SCALE, at, new ScaleDeployment(deploymentId, replicas));
    }

    public void submit(Action action, long at) {
        actionExecutor.submit(action, at);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Runs with the limits from the configuration.
     */
    public KernelState run() {
        return run(config.runLimits());
    }

    public KernelState run(RunLimits limits) {
        return kernel.run(limits);
    }

    public RunReport report() {
        return new RunReport(config.name(), kernel.state(), kernel.now(), kernel.dispatchedCount(),
                kernel.faults(), AdmissionTracker.from(context.requests().values()));
    }

    public SimulationConfig config() {
        return config;
    }

    public SimulationKernel kernel() {
        return kernel;
    }

    public SimulationContext context() {
        return context;
    }

    public DeploymentManager deploymentManager() {
        return deploymentManager;
    }

    public static final class Builder {
        private SimulationConfig config = SimulationConfig.defaults();
        private final List<PhysicalMachine> hosts = new ArrayList<>();
        private Allocator allocator = new FirstFitAllocator();
        private AdmissionPolicy admissionPolicy = AdmissionPolicy.admitAll();
        private ActionInterpreter interpreter = new EmittingActionInterpreter();
        private SimulationObservabilitySink observabilitySink;

        public Builder withConfig(SimulationConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder addHost(String id, Resources capacity) {
            return addHost(PhysicalMachine.of(id, capacity));
        }

        public Builder addHost(PhysicalMachine host) {
            hosts.add(Objects.requireNonNull(host, "host"));
            return this;
        }

        public Builder withAllocator(Allocator allocator) {
            this.allocator = Objects.requireNonNull(allocator, "allocator");
            return this;
        }

        public Builder withAdmissionPolicy(AdmissionPolicy admissionPolicy) {
            this.admissionPolicy = Objects.requireNonNull(admissionPolicy, "admissionPolicy");
            return this;
        }

        public Builder withActionInterpreter(ActionInterpreter interpreter) {
            this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
            return this;
        }

        public Builder withObservabilitySink(SimulationObservabilitySink observabilitySink) {
            this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
            return this;
        }

        public CloudSimulation build() {
            return new CloudSimulation(this);
        }
    }
}

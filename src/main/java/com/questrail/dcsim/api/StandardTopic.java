package com.questrail.dcsim.api;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * StandardTopic
 * -----------------------------------------------------------------------------
 * The catalog of topics the simulation kernel itself understands.
 *
 * <p>
 * The {@code deployment.*} topics are transition notifications emitted by the
 * deployment manager. Operator intent reaches the manager through the two
 * {@code controlplane.*} command topics.
 * </p>
 */
public enum StandardTopic implements Topic
{
    REQUEST_ARRIVE("request.arrive"),
    REQUEST_ACCEPT("request.accept"),
    REQUEST_REJECT("request.reject"),
    REQUEST_STOP("request.stop"),

    ACTION_EXECUTE("action.execute"),

    APP_START("app.start"),
    APP_STOP("app.stop"),
    CONTAINER_START("container.start"),
    CONTAINER_STOP("container.stop"),
    CONTROLLER_START("controller.start"),
    CONTROLLER_STOP("controller.stop"),

    DEPLOYMENT_RUN("deployment.run"),
    DEPLOYMENT_PEND("deployment.pend"),
    DEPLOYMENT_DEGRADE("deployment.degrade"),
    DEPLOYMENT_SCALE("deployment.scale"),
    DEPLOYMENT_STOP("deployment.stop"),

    CONTROLPLANE_APPLY("controlplane.apply"),
    CONTROLPLANE_SCALE("controlplane.scale"),

    VM_ALLOCATE("vm.allocate"),
    VM_DEALLOCATE("vm.deallocate"),
    VM_IDLE("vm.idle"),

    SIM_LOG("sim.log");

    private static final Map<String, StandardTopic> BY_ID = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(StandardTopic::id, Function.identity()));

    private final String id;

    StandardTopic(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    /**
     * Looks up a standard topic by its exact identifier.
     */
    public static Optional<StandardTopic> fromId(String id) {
        return Optional.ofNullable(BY_ID.get(id));
    }

    @Override
    public String toString() {
        return id;
    }
}

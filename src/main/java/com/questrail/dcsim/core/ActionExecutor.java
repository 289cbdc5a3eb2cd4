package com.questrail.dcsim.core;

import com.questrail.dcsim.api.EventPayload.ActionExecution;
import com.questrail.dcsim.api.SimEvent;
import com.questrail.dcsim.api.StandardTopic;
import com.questrail.dcsim.kernel.InvariantViolation;
import com.questrail.dcsim.kernel.SimulationKernel;
import com.questrail.dcsim.model.Action;
import com.questrail.dcsim.model.ActionStep;
import com.questrail.dcsim.policy.ActionInterpreter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs actions one step per {@code action.execute} event.
 *
 * Each step is scheduled {@link ActionStep#delay()} after the previous one ran.
 * A step arriving out of order, or for a completed action, is rejected before
 * the interpreter sees it.
 *
 * <p>
 * A submitted action enters the action arena when its first step is
 * dispatched; until then it is only held here.
 * </p>
 */
public final class ActionExecutor
{
    static final String ENTITY = "action";

    private final SimulationContext context;
    private final ActionInterpreter interpreter;
    private final Map<String, Action> submitted = new HashMap<>();

    public ActionExecutor(SimulationContext context, ActionInterpreter interpreter) {
        this.context = Objects.requireNonNull(context, "context");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
    }

    public void install() {
        context.kernel().subscribe(StandardTopic.ACTION_EXECUTE, "action-executor", this::onExecute);
    }

    /**
     * Schedules the action's first step relative to {@code at}.
     */
    public void submit(Action action, long at) {
        Objects.requireNonNull(action, "action");
        if (submitted.containsKey(action.id()) || context.actions().contains(action.id())) {
            throw new InvariantViolation("duplicate action: " + action.id());
        }
        ActionStep first = action.stepDue(0);
        context.kernel().schedule(StandardTopic.ACTION_EXECUTE, at + first.delay(),
                new ActionExecution(action.id(), 0));
        submitted.put(action.id(), action);
    }

    private void onExecute(SimEvent event) {
        ActionExecution execution = event.payloadAs(ActionExecution.class);
        Action action = context.actions().find(execution.actionId())
                .orElseGet(() -> admit(execution.actionId()));
        ActionStep step = action.stepDue(execution.stepIndex());

        SimulationKernel kernel = context.kernel();
        interpreter.execute(action, step, kernel);
        Action advanced = context.actions().put(action.advanced());

        if (!advanced.isComplete()) {
            ActionStep next = advanced.stepDue(advanced.nextStep());
            kernel.schedule(StandardTopic.ACTION_EXECUTE, kernel.now() + next.delay(),
                    new ActionExecution(advanced.id(), advanced.nextStep()));
        }
    }

    private Action admit(String actionId) {
        Action action = submitted.remove(actionId);
        if (action == null) {
            throw new InvariantViolation("unknown action: " + actionId);
        }
        return context.actions().create(action);
    }
}

package com.questrail.dcsim.policy;

import com.questrail.dcsim.api.EventScheduler;
import com.questrail.dcsim.model.Action;
import com.questrail.dcsim.model.ActionStep;

/**
 * Gives meaning to action steps.
 *
 * Called from the {@code action.execute} handler; side effects must be expressed
 * by scheduling events through the given scheduler.
 */
@FunctionalInterface
public interface ActionInterpreter
{
    void execute(Action action, ActionStep step, EventScheduler scheduler);
}

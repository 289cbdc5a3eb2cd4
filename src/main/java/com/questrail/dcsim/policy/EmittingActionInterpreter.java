package com.questrail.dcsim.policy;

import com.questrail.dcsim.api.EventScheduler;
import com.questrail.dcsim.kernel.InvariantViolation;
import com.questrail.dcsim.model.Action;
import com.questrail.dcsim.model.ActionStep;

/**
 * Default interpreter: understands {@link ActionStep.Emit} and schedules its
 * event at the current virtual time.
 */
public final class EmittingActionInterpreter implements ActionInterpreter
{
    @Override
    public void execute(Action action, ActionStep step, EventScheduler scheduler) {
        if (step instanceof ActionStep.Emit emit) {
            scheduler.scheduleNow(emit.topic(), emit.payload());
            return;
        }
        throw new InvariantViolation("action " + action.id() + ": unsupported step "
                + step.getClass().getSimpleName());
    }
}

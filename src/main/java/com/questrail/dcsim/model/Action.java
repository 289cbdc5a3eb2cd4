package com.questrail.dcsim.model;

import com.questrail.dcsim.kernel.InvariantViolation;

import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of executable steps. {@code nextStep} is the index of the
 * step expected to run next; it equals the step count once the action is done.
 */
public record Action(String id, List<ActionStep> steps, int nextStep) implements Entity
{
    public Action {
        Objects.requireNonNull(id, "id");
        steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("action " + id + " has no steps");
        }
        if (nextStep < 0 || nextStep > steps.size()) {
            throw new IllegalArgumentException("nextStep out of range: " + nextStep);
        }
    }

    public static Action of(String id, List<ActionStep> steps) {
        return new Action(id, steps, 0);
    }

    public static Action of(String id, ActionStep... steps) {
        return new Action(id, List.of(steps), 0);
    }

    public boolean isComplete() {
        return nextStep == steps.size();
    }

    /**
     * Returns the step at {@code index} if it is the one due next.
     *
     * @throws InvariantViolation for out-of-order or repeated execution
     */
    public ActionStep stepDue(int index) {
        if (isComplete()) {
            throw new InvariantViolation("action " + id + " already complete, got step " + index);
        }
        if (index != nextStep) {
            throw new InvariantViolation("action " + id + " expected step " + nextStep + " but got " + index);
        }
        return steps.get(index);
    }

    public Action advanced() {
        if (isComplete()) {
            throw new InvariantViolation("action " + id + " already complete");
        }
        return new Action(id, steps, nextStep + 1);
    }
}

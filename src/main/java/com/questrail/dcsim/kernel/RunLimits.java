package com.questrail.dcsim.kernel;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Termination conditions for a single {@link SimulationKernel#run(RunLimits)}.
 *
 * <ul>
 *   <li>{@code endTime}: horizon. Events later than it stay queued and the run
 *       ends {@code DRAINED}.</li>
 *   <li>{@code maxEvents}: safety valve for handlers that reschedule forever.
 *       Needing more events than this is a {@link KernelFault}.</li>
 * </ul>
 */
public record RunLimits(OptionalLong endTime, OptionalLong maxEvents)
{
    public RunLimits {
        Objects.requireNonNull(endTime, "endTime");
        Objects.requireNonNull(maxEvents, "maxEvents");
        if (endTime.isPresent() && endTime.getAsLong() < 0) {
            throw new IllegalArgumentException("endTime must be >= 0");
        }
        if (maxEvents.isPresent() && maxEvents.getAsLong() <= 0) {
            throw new IllegalArgumentException("maxEvents must be > 0");
        }
    }

    /**
     * Run until the queue is empty.
     */
    public static RunLimits unbounded() {
        return new RunLimits(OptionalLong.empty(), OptionalLong.empty());
    }

    /**
     * Dispatch every event with a timestamp at or before {@code endTime}.
     */
    public static RunLimits until(long endTime) {
        return new RunLimits(OptionalLong.of(endTime), OptionalLong.empty());
    }

    public static RunLimits maxEvents(long maxEvents) {
        return new RunLimits(OptionalLong.empty(), OptionalLong.of(maxEvents));
    }

    public RunLimits withEndTime(long endTime) {
        return new RunLimits(OptionalLong.of(endTime), maxEvents);
    }

    public RunLimits withMaxEvents(long maxEvents) {
        return new RunLimits(endTime, OptionalLong.of(maxEvents));
    }

    boolean beyondHorizon(long timestamp) {
        return endTime.isPresent() && timestamp > endTime.getAsLong();
    }

    boolean exhausted(long dispatched) {
        return maxEvents.isPresent() && dispatched >= maxEvents.getAsLong();
    }
}

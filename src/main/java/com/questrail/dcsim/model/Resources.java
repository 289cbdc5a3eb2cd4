package com.questrail.dcsim.model;

import java.util.Objects;

/**
 * Resource vector used for both host capacity and VM demand.
 *
 * All operations are component-wise. Values are never negative.
 *
 * @param cpu CPU cores
 * @param ram memory units
 */
public record Resources(long cpu, long ram)
{
    public static final Resources ZERO = new Resources(0, 0);

    public Resources {
        if (cpu < 0 || ram < 0) {
            throw new IllegalArgumentException("resources must be >= 0: cpu=" + cpu + ", ram=" + ram);
        }
    }

    public static Resources of(long cpu, long ram) {
        return new Resources(cpu, ram);
    }

    /**
     * Single-dimension resources, for scenarios that only model CPU.
     */
    public static Resources ofCpu(long cpu) {
        return new Resources(cpu, 0);
    }

    public Resources plus(Resources other) {
        Objects.requireNonNull(other, "other");
        return new Resources(Math.addExact(cpu, other.cpu), Math.addExact(ram, other.ram));
    }

    /**
     * @throws IllegalArgumentException if any component would become negative
     */
    public Resources minus(Resources other) {
        Objects.requireNonNull(other, "other");
        return new Resources(cpu - other.cpu, ram - other.ram);
    }

    /**
     * True when every component is at most the corresponding component of {@code limit}.
     */
    public boolean fitsWithin(Resources limit) {
        Objects.requireNonNull(limit, "limit");
        return cpu <= limit.cpu && ram <= limit.ram;
    }

    @Override
    public String toString() {
        return "{cpu=" + cpu + ", ram=" + ram + "}";
    }
}

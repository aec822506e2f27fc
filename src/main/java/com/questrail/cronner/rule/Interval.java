package com.questrail.cronner.rule;

import java.time.ZonedDateTime;
import java.util.Arrays;

/**
 * The cadence of a {@link Rule}: "fire every {@code count} {@code unit}s",
 * measured from the job's last fire time.
 *
 * @param unit  the cadence unit
 * @param count number of units between fires, at least one
 */
public record Interval(IntervalUnit unit, int count) {

    /**
     * Canonical constructor with validation.
     *
     * @throws InvalidIntervalException if {@code unit} is null or {@code count < 1}
     */
    public Interval {
        if (unit == null) {
            throw new InvalidIntervalException("interval unit must be one of " + Arrays.toString(IntervalUnit.values()));
        }
        if (count < 1) {
            throw new InvalidIntervalException("interval count must be >= 1, got " + count);
        }
    }

    public static Interval every(int count, IntervalUnit unit) {
        return new Interval(unit, count);
    }

    /**
     * Returns the first instant at which a job last fired at {@code lastFired}
     * is cadence-due again.
     */
    public ZonedDateTime after(ZonedDateTime lastFired) {
        return unit.addTo(lastFired, count);
    }

    @Override
    public String toString() {
        return count == 1 ? "every " + unit.display(1) : "every " + count + " " + unit.display(count);
    }
}

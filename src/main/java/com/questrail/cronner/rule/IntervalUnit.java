package com.questrail.cronner.rule;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Granularity of an interval cadence.
 *
 * <p>Addition is calendar-aware: {@link #WEEK} and {@link #MONTH} are added
 * through {@link ZonedDateTime} rather than as fixed-length durations, so a
 * month after January 31st is the last day of February.</p>
 */
public enum IntervalUnit {
    SECOND(ChronoUnit.SECONDS, "second"),
    MINUTE(ChronoUnit.MINUTES, "minute"),
    HOUR(ChronoUnit.HOURS, "hour"),
    DAY(ChronoUnit.DAYS, "day"),
    WEEK(ChronoUnit.WEEKS, "week"),
    MONTH(ChronoUnit.MONTHS, "month");

    private final ChronoUnit chronoUnit;
    private final String displayName;

    IntervalUnit(ChronoUnit chronoUnit, String displayName) {
        this.chronoUnit = chronoUnit;
        this.displayName = displayName;
    }

    /**
     * Returns {@code from} advanced by {@code count} of this unit.
     *
     * @param from  starting instant
     * @param count number of units to add
     * @return the advanced instant, in the same zone as {@code from}
     */
    public ZonedDateTime addTo(ZonedDateTime from, long count) {
        return from.plus(count, chronoUnit);
    }

    /**
     * Returns the display string based on the interval count.
     */
    public String display(int count) {
        return count == 1 ? displayName : displayName + "s";
    }

    @Override
    public String toString() {
        return displayName;
    }
}

package com.questrail.cronner.internal.time;

import java.time.ZonedDateTime;

/**
 * WallClock
 * =============================================================================
 * Zoned wall-clock source for due-time decisions.
 *
 * <p>
 * Calendar constraints (day-of-month, hour-of-day, ...) are evaluated against
 * the components of this clock's time in its zone, and {@code lastFired} is
 * recorded from it. It may jump due to DST or NTP adjustments; tick pacing
 * uses {@link MonotonicClock} instead.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time in the clock's zone.
     */
    ZonedDateTime now();
}

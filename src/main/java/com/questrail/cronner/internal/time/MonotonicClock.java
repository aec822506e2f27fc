package com.questrail.cronner.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for tick pacing and job run durations.
 *
 * <p>
 * Tick boundaries are computed in monotonic nanoseconds so the polling cadence
 * is unaffected by wall-clock adjustments. Due-time decisions use
 * {@link WallClock} because calendar constraints refer to wall-clock fields.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}

package com.questrail.cronner.internal.time;

/**
 * MonotonicScheduler
 * =============================================================================
 * Deferred-execution surface the dispatcher uses to pace its ticks.
 *
 * <p>Deadlines are expressed in monotonic nanoseconds from a
 * {@link MonotonicClock}, never in wall-clock instants.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos monotonic deadline in nanoseconds (from {@link MonotonicClock#nowNanos()})
     * @param task          runnable task
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);
}

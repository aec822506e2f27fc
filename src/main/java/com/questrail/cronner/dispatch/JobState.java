package com.questrail.cronner.dispatch;

/**
 * Execution state of a {@link ScheduledJob}.
 */
public enum JobState {
    /** Eligible for due-time evaluation on the next tick. */
    IDLE,
    /** Action dispatched and not yet returned; never evaluated while in this state. */
    RUNNING
}

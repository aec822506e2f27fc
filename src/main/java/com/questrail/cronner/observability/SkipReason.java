package com.questrail.cronner.observability;

/** Why a tick did not evaluate a job. */
public enum SkipReason {
    /** The previous invocation has not returned yet. */
    RUNNING,
    /** The job is paused until a later instant. */
    PAUSED,
    /** The job was cancelled and will never fire again. */
    CANCELLED
}

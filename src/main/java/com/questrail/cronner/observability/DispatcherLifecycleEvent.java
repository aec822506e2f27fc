package com.questrail.cronner.observability;

import java.time.ZonedDateTime;

/**
 * Record representing a dispatcher start or stop.
 */
public record DispatcherLifecycleEvent(
    ZonedDateTime timestamp,
    Phase phase,
    int jobCount
) {
    public enum Phase {
        STARTED,
        STOPPED
    }
}

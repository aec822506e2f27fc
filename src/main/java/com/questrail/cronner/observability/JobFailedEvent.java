package com.questrail.cronner.observability;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * Record representing a job invocation whose action threw.
 */
public record JobFailedEvent(
    ZonedDateTime tickInstant,
    String jobName,
    Duration elapsed,
    Throwable cause
) {
}

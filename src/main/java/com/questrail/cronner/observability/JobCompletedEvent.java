package com.questrail.cronner.observability;

import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * Record representing a job invocation that returned normally.
 *
 * @param tickInstant the tick instant that fired the job (its new {@code lastFired})
 * @param elapsed     monotonic run time of the action
 */
public record JobCompletedEvent(
    ZonedDateTime tickInstant,
    String jobName,
    Duration elapsed
) {
}

package com.questrail.cronner.observability;

import java.time.ZonedDateTime;

/**
 * Record representing an error in the dispatcher outside a job's action,
 * such as a rejected dispatch or a failing eligibility filter.
 */
public record CronnerErrorEvent(
    ZonedDateTime timestamp,
    String message,
    Throwable cause
) {
}

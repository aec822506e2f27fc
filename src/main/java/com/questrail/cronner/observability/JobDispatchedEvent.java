package com.questrail.cronner.observability;

import java.time.ZonedDateTime;

/**
 * Record representing a due job handed to the job executor on a tick.
 */
public record JobDispatchedEvent(
    ZonedDateTime tickInstant,
    String jobName
) {
}

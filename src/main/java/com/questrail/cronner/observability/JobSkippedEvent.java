package com.questrail.cronner.observability;

import java.time.ZonedDateTime;

/**
 * Record representing a job a tick passed over without evaluating its rule.
 *
 * <p>A {@link SkipReason#RUNNING} skip is the observable form of a missed
 * tick: any due instant during the run is dropped, not queued.</p>
 */
public record JobSkippedEvent(
    ZonedDateTime tickInstant,
    String jobName,
    SkipReason reason
) {
}

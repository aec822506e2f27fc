package com.questrail.cronner.dispatch;

import java.time.ZonedDateTime;

/**
 * Dispatcher-wide veto consulted after a job's rule reports it due.
 *
 * <p>Returning {@code false} suppresses the fire without touching the job's
 * cadence. A filter that throws is reported as a dispatcher error and treated
 * as {@code false}.</p>
 *
 * <p>Filters typically key on {@link ScheduledJob#tag()} or
 * {@link ScheduledJob#name()}.</p>
 */
@FunctionalInterface
public interface EligibilityFilter {

    EligibilityFilter ALLOW_ALL = (job, now) -> true;

    boolean permits(ScheduledJob job, ZonedDateTime now);
}

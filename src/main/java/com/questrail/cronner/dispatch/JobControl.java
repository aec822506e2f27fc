package com.questrail.cronner.dispatch;

import java.time.Duration;
import java.time.Instant;

/**
 * Handle passed to a running {@link JobAction} for steering its own job.
 */
public interface JobControl {

    /** Name of the job being run. */
    String jobName();

    /** Stops the job permanently; it stays registered but never fires again. */
    void cancel();

    /** Suppresses fires up to and including {@code until}. */
    void pauseUntil(Instant until);

    /** Suppresses fires for {@code duration} from the current wall-clock time. */
    void pauseFor(Duration duration);
}

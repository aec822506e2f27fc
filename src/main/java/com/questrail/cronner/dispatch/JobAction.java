package com.questrail.cronner.dispatch;

import java.util.Objects;

/**
 * A unit of work that receives a {@link JobControl} so it can cancel or pause
 * its own job.
 *
 * <p>Plain {@link Runnable}s are adapted to this interface on registration.</p>
 */
@FunctionalInterface
public interface JobAction {

    /**
     * Runs the job once.
     *
     * @param control handle for steering the job's future fires
     * @throws Exception any failure; it is reported and contained by the dispatcher
     */
    void run(JobControl control) throws Exception;

    static JobAction of(Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable");
        return control -> runnable.run();
    }
}

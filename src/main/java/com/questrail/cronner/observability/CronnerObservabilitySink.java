package com.questrail.cronner.observability;

/**
 * Main interface for receiving dispatcher observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on the tick thread or on job worker threads, so
 * implementations must be thread-safe.</p>
 */
public interface CronnerObservabilitySink {
    /**
     * Called when the dispatcher starts or stops ticking.
     */
    void onLifecycle(DispatcherLifecycleEvent event);

    /**
     * Called when a due job has been handed to the job executor.
     */
    void onJobDispatched(JobDispatchedEvent event);

    /**
     * Called when a job's action returned normally.
     */
    void onJobCompleted(JobCompletedEvent event);

    /**
     * Called when a job's action threw. The failure never propagates further.
     */
    void onJobFailed(JobFailedEvent event);

    /**
     * Called when a tick passed over a job without evaluating it
     * (still running, paused, or cancelled).
     */
    void onJobSkipped(JobSkippedEvent event);

    /**
     * Called when the dispatcher itself hit an error outside a job's action.
     */
    void onError(CronnerErrorEvent event);
}

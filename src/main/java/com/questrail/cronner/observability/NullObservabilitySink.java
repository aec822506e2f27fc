package com.questrail.cronner.observability;

/**
 * No-op implementation of CronnerObservabilitySink.
 */
public final class NullObservabilitySink implements CronnerObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLifecycle(DispatcherLifecycleEvent event) {}

    @Override
    public void onJobDispatched(JobDispatchedEvent event) {}

    @Override
    public void onJobCompleted(JobCompletedEvent event) {}

    @Override
    public void onJobFailed(JobFailedEvent event) {}

    @Override
    public void onJobSkipped(JobSkippedEvent event) {}

    @Override
    public void onError(CronnerErrorEvent event) {}
}

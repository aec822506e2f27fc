package com.questrail.cronner.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CronnerObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCronnerObservabilitySink implements CronnerObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCronnerObservabilitySink.class);

    @Override
    public void onLifecycle(DispatcherLifecycleEvent event) {
        log.info("Dispatcher {} with {} job(s)",
            event.phase() == DispatcherLifecycleEvent.Phase.STARTED ? "started" : "stopped",
            event.jobCount());
    }

    @Override
    public void onJobDispatched(JobDispatchedEvent event) {
        log.debug("Starting job {} for tick {}", event.jobName(), event.tickInstant());
    }

    @Override
    public void onJobCompleted(JobCompletedEvent event) {
        log.debug("Completed job {} in {} ms", event.jobName(), event.elapsed().toMillis());
    }

    @Override
    public void onJobFailed(JobFailedEvent event) {
        log.error("Failed to run job {} (tick {}, after {} ms)",
            event.jobName(),
            event.tickInstant(),
            event.elapsed().toMillis(),
            event.cause());
    }

    @Override
    public void onJobSkipped(JobSkippedEvent event) {
        // RUNNING and CANCELLED repeat on every tick
        if (event.reason() == SkipReason.RUNNING) {
            log.trace("Job {} still running at tick {}; tick dropped", event.jobName(), event.tickInstant());
        } else if (event.reason() == SkipReason.CANCELLED) {
            log.trace("Job {} cancelled; skipped at tick {}", event.jobName(), event.tickInstant());
        } else {
            log.debug("Job {} skipped at tick {}: {}", event.jobName(), event.tickInstant(), event.reason());
        }
    }

    @Override
    public void onError(CronnerErrorEvent event) {
        log.error("Dispatcher error: {}", event.message(), event.cause());
    }
}

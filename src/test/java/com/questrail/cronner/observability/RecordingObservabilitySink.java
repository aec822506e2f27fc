package com.questrail.cronner.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements CronnerObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onLifecycle(DispatcherLifecycleEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onJobDispatched(JobDispatchedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onJobCompleted(JobCompletedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onJobFailed(JobFailedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onJobSkipped(JobSkippedEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(CronnerErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}

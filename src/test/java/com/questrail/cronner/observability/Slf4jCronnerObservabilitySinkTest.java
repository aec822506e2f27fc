package com.questrail.cronner.observability;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class Slf4jCronnerObservabilitySinkTest {

    private static final ZonedDateTime TICK = ZonedDateTime.of(2024, 5, 6, 8, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void logsEveryEventKind() {
        Slf4jCronnerObservabilitySink sink = new Slf4jCronnerObservabilitySink();

        assertDoesNotThrow(() -> {
            sink.onLifecycle(new DispatcherLifecycleEvent(TICK, DispatcherLifecycleEvent.Phase.STARTED, 2));
            sink.onJobDispatched(new JobDispatchedEvent(TICK, "report"));
            sink.onJobCompleted(new JobCompletedEvent(TICK, "report", Duration.ofMillis(12)));
            sink.onJobFailed(new JobFailedEvent(TICK, "report", Duration.ofMillis(3), new IllegalStateException("boom")));
            for (SkipReason reason : SkipReason.values()) {
                sink.onJobSkipped(new JobSkippedEvent(TICK, "report", reason));
            }
            sink.onError(new CronnerErrorEvent(TICK, "filter failed", new RuntimeException("x")));
            sink.onLifecycle(new DispatcherLifecycleEvent(TICK, DispatcherLifecycleEvent.Phase.STOPPED, 2));
        });
    }
}

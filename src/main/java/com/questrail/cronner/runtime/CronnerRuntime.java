package com.questrail.cronner.runtime;

import com.questrail.cronner.config.DispatcherConfig;
import com.questrail.cronner.dispatch.DispatchMode;
import com.questrail.cronner.dispatch.Dispatcher;
import com.questrail.cronner.dispatch.EligibilityFilter;
import com.questrail.cronner.dispatch.JobAction;
import com.questrail.cronner.dispatch.ScheduledJob;
import com.questrail.cronner.internal.time.MonotonicClock;
import com.questrail.cronner.internal.time.MonotonicScheduler;
import com.questrail.cronner.internal.time.ScheduledExecutorScheduler;
import com.questrail.cronner.internal.time.SystemMonotonicClock;
import com.questrail.cronner.internal.time.SystemWallClock;
import com.questrail.cronner.internal.time.WallClock;
import com.questrail.cronner.observability.CronnerObservabilitySink;
import com.questrail.cronner.observability.Slf4jCronnerObservabilitySink;
import com.questrail.cronner.rule.Rule;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CronnerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a production {@link Dispatcher}.
 *
 * <p>Creates the single-threaded tick executor and, in
 * {@link DispatchMode#THREADED} mode, the job worker pool, and wires the
 * system clocks and an SLF4J observability sink unless others are supplied.</p>
 *
 * <pre>
 *   try (CronnerRuntime cronner = CronnerRuntime.builder().build()) {
 *       cronner.add("report", this::sendReport, Rule.every(5, IntervalUnit.MINUTE).build());
 *       cronner.start();
 *       ...
 *   }
 * </pre>
 *
 * {@link #stop()} pauses ticking and may be followed by {@link #start()};
 * {@link #close()} stops and releases the executors for good. Running actions
 * are never interrupted.
 */
public final class CronnerRuntime implements AutoCloseable {
    private final Dispatcher dispatcher;
    private final ScheduledExecutorService tickExecutor;
    private final ExecutorService workerExecutor;

    private CronnerRuntime(Dispatcher dispatcher,
                           ScheduledExecutorService tickExecutor,
                           ExecutorService workerExecutor) {
        this.dispatcher = dispatcher;
        this.tickExecutor = tickExecutor;
        this.workerExecutor = workerExecutor;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public void start() {
        dispatcher.start();
    }

    public void stop() {
        dispatcher.stop();
    }

    public boolean isRunning() {
        return dispatcher.isRunning();
    }

    public ScheduledJob add(Runnable action, Rule rule) {
        return dispatcher.add(action, rule);
    }

    public ScheduledJob add(String name, Runnable action, Rule rule) {
        return dispatcher.add(name, action, rule);
    }

    public ScheduledJob add(String name, JobAction action, Rule rule) {
        return dispatcher.add(name, action, rule);
    }

    public ScheduledJob add(String name, Runnable action, Rule rule, Object tag) {
        return dispatcher.add(name, action, rule, tag);
    }

    public ScheduledJob add(String name, JobAction action, Rule rule, Object tag) {
        return dispatcher.add(name, action, rule, tag);
    }

    public boolean remove(ScheduledJob job) {
        return dispatcher.remove(job);
    }

    public List<ScheduledJob> jobs() {
        return dispatcher.jobs();
    }

    public Optional<ScheduledJob> find(String name) {
        return dispatcher.find(name);
    }

    @Override
    public void close() {
        dispatcher.stop();
        tickExecutor.shutdown();
        try {
            if (!tickExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                tickExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            tickExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (workerExecutor != null) {
            // no timeout is imposed on actions; in-flight jobs finish on their own
            workerExecutor.shutdown();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DispatcherConfig config = DispatcherConfig.defaults();
        private CronnerObservabilitySink observabilitySink = new Slf4jCronnerObservabilitySink();
        private EligibilityFilter eligibilityFilter = EligibilityFilter.ALLOW_ALL;
        private WallClock wallClock;

        public Builder withConfig(DispatcherConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(CronnerObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withEligibilityFilter(EligibilityFilter filter) {
            this.eligibilityFilter = filter;
            return this;
        }

        /**
         * Overrides the wall clock; defaults to the system clock in the
         * configured zone.
         */
        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public CronnerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            WallClock effectiveWallClock = wallClock != null ? wallClock : new SystemWallClock(config.zone());

            ScheduledExecutorService tickExec = Executors.newSingleThreadScheduledExecutor(
                    namedThreads("cronner-dispatcher", false));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(tickExec, clock);

            ExecutorService workerExec = config.dispatchMode() == DispatchMode.THREADED
                    ? Executors.newCachedThreadPool(namedThreads(config.workerThreadPrefix(), config.daemonWorkers()))
                    : null;

            Dispatcher dispatcher = new Dispatcher(
                    config,
                    effectiveWallClock,
                    clock,
                    scheduler,
                    workerExec,
                    eligibilityFilter,
                    observabilitySink
            );

            return new CronnerRuntime(dispatcher, tickExec, workerExec);
        }

        private static ThreadFactory namedThreads(String prefix, boolean daemon) {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
                thread.setDaemon(daemon);
                return thread;
            };
        }
    }
}

package com.questrail.cronner.dispatch;

import com.questrail.cronner.config.DispatcherConfig;
import com.questrail.cronner.internal.time.Cancellable;
import com.questrail.cronner.internal.time.MonotonicClock;
import com.questrail.cronner.internal.time.MonotonicScheduler;
import com.questrail.cronner.internal.time.WallClock;
import com.questrail.cronner.observability.CronnerErrorEvent;
import com.questrail.cronner.observability.CronnerObservabilitySink;
import com.questrail.cronner.observability.DispatcherLifecycleEvent;
import com.questrail.cronner.observability.JobCompletedEvent;
import com.questrail.cronner.observability.JobDispatchedEvent;
import com.questrail.cronner.observability.JobFailedEvent;
import com.questrail.cronner.observability.JobSkippedEvent;
import com.questrail.cronner.observability.NullObservabilitySink;
import com.questrail.cronner.observability.SkipReason;
import com.questrail.cronner.rule.Rule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dispatcher
 * =============================================================================
 * The run loop: owns the registered {@link ScheduledJob}s, wakes on a fixed
 * tick, asks every job whether it is due, and dispatches the due ones.
 *
 * <h2>Tick</h2>
 * <ol>
 *   <li>Observe the tick instant from the {@link WallClock}, truncated to whole
 *       seconds.</li>
 *   <li>For each job in a snapshot of the collection, in registration order:
 *       skip it if cancelled, RUNNING or paused; otherwise evaluate its
 *       {@link Rule}, then the {@link EligibilityFilter}.</li>
 *   <li>Move each due job IDLE→RUNNING and hand it to the job executor. On
 *       completion its {@code lastFired} becomes the tick instant and it
 *       returns to IDLE, whether the action succeeded or threw.</li>
 * </ol>
 *
 * <h2>Threading Model</h2>
 * Ticks are paced by a {@link MonotonicScheduler}; with a single-threaded
 * scheduler executor there is exactly one coordinating loop. Actions run on
 * the tick thread in {@link DispatchMode#INLINE} mode and on the supplied
 * executor in {@link DispatchMode#THREADED} mode. The job collection is a
 * copy-on-write list, so {@link #add} and {@link #remove} are safe from any
 * thread and a job added mid-tick is first evaluated on the next tick.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   dispatcher.start()   → schedules ticks at fixed tickPeriod boundaries
 *   dispatcher.stop()    → cancels the pending tick; an in-flight tick and
 *                          in-flight actions run to completion
 *   dispatcher.start()   → resumes ticking
 * </pre>
 * {@link #tick()} may also be called directly to drive the loop by hand.
 *
 * <h2>Failure Isolation</h2>
 * Anything an action throws, {@link Error}s included, is reported to the
 * observability sink as a failed run and does not reach the tick loop or the
 * jobs after it. Only a {@link VirtualMachineError} is rethrown, after it has
 * been reported. Missed ticks of a running job are dropped and
 * reported as {@link SkipReason#RUNNING}, not queued.
 */
public final class Dispatcher {

    private final Duration tickPeriod;
    private final WallClock wallClock;
    private final MonotonicClock monotonicClock;
    private final MonotonicScheduler scheduler;
    private final Executor jobExecutor;
    private final EligibilityFilter eligibilityFilter;
    private final CronnerObservabilitySink observabilitySink;

    private final List<ScheduledJob> jobs = new CopyOnWriteArrayList<>();
    private final Object registrationLock = new Object();
    private final AtomicLong nameSequence = new AtomicLong();

    private final Object lifecycleLock = new Object();
    private volatile boolean running;
    private long generation;
    private long nextTickNanos;
    private Cancellable pendingTick;

    /**
     * Creates a dispatcher.
     *
     * @param config            tick period and dispatch mode
     * @param wallClock         zoned time source for due-time decisions
     * @param monotonicClock    time source for tick pacing and run durations
     * @param scheduler         runs the ticks
     * @param jobExecutor       runs actions in {@link DispatchMode#THREADED} mode; ignored for INLINE
     * @param eligibilityFilter optional veto after a rule reports due
     * @param observabilitySink optional event sink
     */
    public Dispatcher(DispatcherConfig config,
                      WallClock wallClock,
                      MonotonicClock monotonicClock,
                      MonotonicScheduler scheduler,
                      Executor jobExecutor,
                      EligibilityFilter eligibilityFilter,
                      CronnerObservabilitySink observabilitySink)
    {
        Objects.requireNonNull(config, "config");
        this.tickPeriod = config.tickPeriod();
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.jobExecutor = config.dispatchMode() == DispatchMode.INLINE
                ? Runnable::run
                : Objects.requireNonNull(jobExecutor, "jobExecutor");
        this.eligibilityFilter = Objects.requireNonNullElse(eligibilityFilter, EligibilityFilter.ALLOW_ALL);
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public Dispatcher(DispatcherConfig config,
                      WallClock wallClock,
                      MonotonicClock monotonicClock,
                      MonotonicScheduler scheduler,
                      Executor jobExecutor)
    {
        this(config, wallClock, monotonicClock, scheduler, jobExecutor, null, null);
    }

    // ---------------------------------------------------------------------
    // Registration
    // ---------------------------------------------------------------------

    public ScheduledJob add(Runnable action, Rule rule) {
        return add(null, JobAction.of(action), rule, null);
    }

    public ScheduledJob add(String name, Runnable action, Rule rule) {
        return add(name, JobAction.of(action), rule, null);
    }

    public ScheduledJob add(String name, JobAction action, Rule rule) {
        return add(name, action, rule, null);
    }

    public ScheduledJob add(String name, Runnable action, Rule rule, Object tag) {
        return add(name, JobAction.of(action), rule, tag);
    }

    /**
     * Registers {@code action} under {@code rule}. The job starts IDLE and
     * never fired, so it is eligible on the next tick.
     *
     * @param name   requested name; {@code null} or blank assigns {@code job-N}.
     *               A name already in use gets a {@code :2}, {@code :3}, ... suffix.
     * @param tag    optional caller data exposed as {@link ScheduledJob#tag()}
     * @return the registered job, also the handle for {@link #remove(ScheduledJob)}
     */
    public ScheduledJob add(String name, JobAction action, Rule rule, Object tag) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(rule, "rule");

        synchronized (registrationLock) {
            ScheduledJob job = new ScheduledJob(uniqueName(name), action, rule, tag);
            jobs.add(job);
            return job;
        }
    }

    /**
     * Unregisters {@code job}. An in-flight invocation still completes.
     *
     * @return true if the job was registered
     */
    public boolean remove(ScheduledJob job) {
        Objects.requireNonNull(job, "job");
        synchronized (registrationLock) {
            return jobs.remove(job);
        }
    }

    /**
     * Snapshot of the registered jobs in registration order.
     */
    public List<ScheduledJob> jobs() {
        return List.copyOf(jobs);
    }

    public Optional<ScheduledJob> find(String name) {
        return jobs.stream().filter(j -> j.name().equals(name)).findFirst();
    }

    private String uniqueName(String requested) {
        String base = requested == null || requested.isBlank()
                ? "job-" + nameSequence.incrementAndGet()
                : requested;

        String candidate = base;
        int index = 1;
        while (isNameTaken(candidate)) {
            index++;
            candidate = base + ":" + index;
        }
        return candidate;
    }

    private boolean isNameTaken(String name) {
        for (ScheduledJob job : jobs) {
            if (job.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Starts ticking at fixed {@code tickPeriod} boundaries.
     *
     * @throws AlreadyRunningException if already running
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                throw new AlreadyRunningException("Dispatcher is already running");
            }
            running = true;
            long currentGeneration = ++generation;
            nextTickNanos = monotonicClock.nowNanos() + tickPeriod.toNanos();
            pendingTick = scheduler.scheduleAtNanos(nextTickNanos, () -> runScheduledTick(currentGeneration));
        }
        observabilitySink.onLifecycle(new DispatcherLifecycleEvent(
            wallClock.now(), DispatcherLifecycleEvent.Phase.STARTED, jobs.size()));
    }

    /**
     * Stops ticking. A tick already in progress finishes its evaluation and
     * dispatched actions are not interrupted. No-op if not running.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            generation++;
            if (pendingTick != null) {
                pendingTick.cancel();
                pendingTick = null;
            }
        }
        observabilitySink.onLifecycle(new DispatcherLifecycleEvent(
            wallClock.now(), DispatcherLifecycleEvent.Phase.STOPPED, jobs.size()));
    }

    public boolean isRunning() {
        return running;
    }

    private void runScheduledTick(long tickGeneration) {
        synchronized (lifecycleLock) {
            if (!running || tickGeneration != generation) {
                return;
            }
        }
        try {
            tick();
        } catch (Throwable t) {
            observabilitySink.onError(new CronnerErrorEvent(wallClock.now(), "Tick failed", t));
            rethrowIfFatal(t);
        } finally {
            scheduleNextTick(tickGeneration);
        }
    }

    private void scheduleNextTick(long tickGeneration) {
        synchronized (lifecycleLock) {
            if (!running || tickGeneration != generation) {
                return;
            }
            // Skip boundaries an overrunning tick already missed instead of bursting.
            long period = tickPeriod.toNanos();
            long now = monotonicClock.nowNanos();
            long next = nextTickNanos + period;
            if (next <= now) {
                next += ((now - next) / period + 1) * period;
            }
            nextTickNanos = next;
            pendingTick = scheduler.scheduleAtNanos(next, () -> runScheduledTick(tickGeneration));
        }
    }

    // ---------------------------------------------------------------------
    // Tick
    // ---------------------------------------------------------------------

    /**
     * Runs one evaluation pass over the registered jobs at the current
     * wall-clock time. Called by the scheduled loop; may be called directly.
     */
    public void tick() {
        ZonedDateTime tickInstant = wallClock.now().truncatedTo(ChronoUnit.SECONDS);
        for (ScheduledJob job : jobs) {
            evaluate(job, tickInstant);
        }
    }

    private void evaluate(ScheduledJob job, ZonedDateTime tickInstant) {
        if (job.isCancelled()) {
            skipped(job, tickInstant, SkipReason.CANCELLED);
            return;
        }
        // Never evaluate a running job; its due instant is dropped.
        if (job.state() == JobState.RUNNING) {
            skipped(job, tickInstant, SkipReason.RUNNING);
            return;
        }
        if (job.isPausedAt(tickInstant)) {
            skipped(job, tickInstant, SkipReason.PAUSED);
            return;
        }
        if (!job.isDue(tickInstant) || !permits(job, tickInstant)) {
            return;
        }
        if (!job.tryBeginRun()) {
            skipped(job, tickInstant, SkipReason.RUNNING);
            return;
        }

        observabilitySink.onJobDispatched(new JobDispatchedEvent(tickInstant, job.name()));
        try {
            jobExecutor.execute(() -> runJob(job, tickInstant));
        } catch (RejectedExecutionException e) {
            job.abortRun();
            observabilitySink.onError(new CronnerErrorEvent(
                tickInstant, "Job executor rejected job " + job.name(), e));
        }
    }

    private boolean permits(ScheduledJob job, ZonedDateTime tickInstant) {
        try {
            return eligibilityFilter.permits(job, tickInstant);
        } catch (Throwable t) {
            observabilitySink.onError(new CronnerErrorEvent(
                tickInstant, "Eligibility filter failed for job " + job.name(), t));
            rethrowIfFatal(t);
            return false;
        }
    }

    private void runJob(ScheduledJob job, ZonedDateTime tickInstant) {
        long startedNanos = monotonicClock.nowNanos();
        Throwable failure = null;
        try {
            job.invoke(new DispatcherJobControl(job));
        } catch (Throwable t) {
            failure = t;
        } finally {
            job.completeRun(tickInstant);
        }

        Duration elapsed = Duration.ofNanos(monotonicClock.nowNanos() - startedNanos);
        if (failure == null) {
            observabilitySink.onJobCompleted(new JobCompletedEvent(tickInstant, job.name(), elapsed));
            return;
        }
        observabilitySink.onJobFailed(new JobFailedEvent(tickInstant, job.name(), elapsed, failure));
        rethrowIfFatal(failure);
    }

    /**
     * The JVM cannot be trusted to keep running after a
     * {@link VirtualMachineError}; everything else stays contained.
     */
    private static void rethrowIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError) {
            throw (VirtualMachineError) t;
        }
    }

    private void skipped(ScheduledJob job, ZonedDateTime tickInstant, SkipReason reason) {
        observabilitySink.onJobSkipped(new JobSkippedEvent(tickInstant, job.name(), reason));
    }

    /**
     * {@link JobControl} bound to one job; {@code pauseFor} is measured on the
     * dispatcher's wall clock.
     */
    private final class DispatcherJobControl implements JobControl {
        private final ScheduledJob job;

        private DispatcherJobControl(ScheduledJob job) {
            this.job = job;
        }

        @Override
        public String jobName() {
            return job.name();
        }

        @Override
        public void cancel() {
            job.cancel();
        }

        @Override
        public void pauseUntil(Instant until) {
            job.pauseUntil(until);
        }

        @Override
        public void pauseFor(Duration duration) {
            Objects.requireNonNull(duration, "duration");
            job.pauseUntil(wallClock.now().toInstant().plus(duration));
        }
    }
}

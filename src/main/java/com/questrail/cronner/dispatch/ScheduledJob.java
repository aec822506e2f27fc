package com.questrail.cronner.dispatch;

import com.questrail.cronner.rule.Rule;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ScheduledJob
 * =============================================================================
 * One registered action paired with one {@link Rule}, plus the bookkeeping the
 * dispatcher needs to decide when it is next due.
 *
 * <h2>State</h2>
 * <pre>
 *   IDLE ──(dispatched on a tick)──▶ RUNNING ──(action returns or throws)──▶ IDLE
 * </pre>
 * The IDLE→RUNNING transition is a compare-and-set, so two invocations of the
 * same job never overlap. A RUNNING job is not evaluated; due instants that
 * pass while it runs are dropped.
 *
 * <h2>lastFired</h2>
 * Set to the instant the firing tick observed, never the completion instant,
 * so job run time does not drift the cadence. Only the dispatcher writes it.
 *
 * <h2>Thread Safety</h2>
 * All fields are read by the tick thread and written by worker threads or
 * callers; they are atomic or volatile.
 *
 * <p>Instances are created by {@link Dispatcher#add(String, JobAction, Rule, Object)}
 * and double as the handle for {@link Dispatcher#remove(ScheduledJob)}.</p>
 */
public final class ScheduledJob {

    private final String name;
    private final JobAction action;
    private final Rule rule;
    private final Object tag;

    private final AtomicReference<JobState> state = new AtomicReference<>(JobState.IDLE);
    private volatile ZonedDateTime lastFired;
    private volatile boolean cancelled;
    private volatile Instant pausedUntil;

    ScheduledJob(String name, JobAction action, Rule rule, Object tag) {
        this.name = Objects.requireNonNull(name, "name");
        this.action = Objects.requireNonNull(action, "action");
        this.rule = Objects.requireNonNull(rule, "rule");
        this.tag = tag;
    }

    public String name() {
        return name;
    }

    public Rule rule() {
        return rule;
    }

    /**
     * Caller data attached at registration, opaque to the dispatcher. An
     * {@link EligibilityFilter} can use it to tell jobs apart without
     * relying on their names.
     */
    public Optional<Object> tag() {
        return Optional.ofNullable(tag);
    }

    /**
     * Returns the tag if it is an instance of {@code type}.
     */
    public <T> Optional<T> tag(Class<T> type) {
        return tag().filter(type::isInstance).map(type::cast);
    }

    public JobState state() {
        return state.get();
    }

    /**
     * Tick instant of the most recent fire, or empty if the job never fired.
     */
    public Optional<ZonedDateTime> lastFired() {
        return Optional.ofNullable(lastFired);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public Optional<Instant> pausedUntil() {
        return Optional.ofNullable(pausedUntil);
    }

    /**
     * Stops the job permanently. An in-flight invocation is not interrupted.
     */
    public void cancel() {
        cancelled = true;
    }

    /**
     * Suppresses fires while the tick instant is at or before {@code until}.
     */
    public void pauseUntil(Instant until) {
        this.pausedUntil = Objects.requireNonNull(until, "until");
    }

    /**
     * Clears any pause set by {@link #pauseUntil(Instant)}.
     */
    public void resume() {
        this.pausedUntil = null;
    }

    boolean isPausedAt(ZonedDateTime now) {
        Instant until = pausedUntil;
        return until != null && !until.isBefore(now.toInstant());
    }

    boolean isDue(ZonedDateTime now) {
        return rule.isDue(now, lastFired());
    }

    /**
     * IDLE → RUNNING. Returns false if the job is already running.
     */
    boolean tryBeginRun() {
        return state.compareAndSet(JobState.IDLE, JobState.RUNNING);
    }

    /**
     * RUNNING → IDLE after the action returned or threw; records the fire.
     */
    void completeRun(ZonedDateTime tickInstant) {
        lastFired = tickInstant;
        state.set(JobState.IDLE);
    }

    /**
     * RUNNING → IDLE without recording a fire, for a dispatch that never
     * reached the action.
     */
    void abortRun() {
        state.set(JobState.IDLE);
    }

    void invoke(JobControl control) throws Exception {
        action.run(control);
    }

    @Override
    public String toString() {
        return "ScheduledJob{" +
                "name='" + name + '\'' +
                ", rule=" + rule +
                (tag != null ? ", tag=" + tag : "") +
                ", state=" + state.get() +
                ", lastFired=" + lastFired +
                (cancelled ? ", cancelled" : "") +
                '}';
    }
}

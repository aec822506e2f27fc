package com.questrail.cronner.config;

import com.questrail.cronner.dispatch.DispatchMode;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * DispatcherConfig
 * -----------------------------------------------------------------------------
 * Operational configuration for the dispatcher and the runtime that hosts it.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>tickPeriod</b>: polling period of the run loop. Must be positive and
 *       no coarser than one second, the finest interval unit, so no due instant
 *       is missed by more than one tick.</li>
 *   <li><b>dispatchMode</b>: {@link DispatchMode#INLINE} runs actions on the
 *       tick thread; {@link DispatchMode#THREADED} gives each invocation its
 *       own worker.</li>
 *   <li><b>zone</b>: zone in which calendar constraints are evaluated.</li>
 *   <li><b>daemonWorkers</b>: whether job worker threads are daemon threads,
 *       i.e. whether a running job keeps the JVM alive.</li>
 *   <li><b>workerThreadPrefix</b>: name prefix for job worker threads.</li>
 * </ul>
 */
public record DispatcherConfig(
        Duration tickPeriod,
        DispatchMode dispatchMode,
        ZoneId zone,
        boolean daemonWorkers,
        String workerThreadPrefix
) {
    public static final Duration MAX_TICK_PERIOD = Duration.ofSeconds(1);

    public DispatcherConfig {
        Objects.requireNonNull(tickPeriod, "tickPeriod");
        Objects.requireNonNull(dispatchMode, "dispatchMode");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(workerThreadPrefix, "workerThreadPrefix");

        if (tickPeriod.isZero() || tickPeriod.isNegative()) {
            throw new IllegalArgumentException("tickPeriod must be > 0");
        }
        if (tickPeriod.compareTo(MAX_TICK_PERIOD) > 0) {
            throw new IllegalArgumentException("tickPeriod must be <= " + MAX_TICK_PERIOD + ", got " + tickPeriod);
        }
        if (workerThreadPrefix.isBlank()) {
            throw new IllegalArgumentException("workerThreadPrefix must not be blank");
        }
    }

    /**
     * Defaults: one-second ticks, threaded dispatch, system zone, non-daemon
     * workers named {@code cronner-job-N}.
     */
    public static DispatcherConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration tickPeriod = MAX_TICK_PERIOD;
        private DispatchMode dispatchMode = DispatchMode.THREADED;
        private ZoneId zone = ZoneId.systemDefault();
        private boolean daemonWorkers = false;
        private String workerThreadPrefix = "cronner-job";

        public Builder withTickPeriod(Duration tickPeriod) {
            this.tickPeriod = tickPeriod;
            return this;
        }

        public Builder withDispatchMode(DispatchMode dispatchMode) {
            this.dispatchMode = dispatchMode;
            return this;
        }

        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder withDaemonWorkers(boolean daemonWorkers) {
            this.daemonWorkers = daemonWorkers;
            return this;
        }

        public Builder withWorkerThreadPrefix(String workerThreadPrefix) {
            this.workerThreadPrefix = workerThreadPrefix;
            return this;
        }

        public DispatcherConfig build() {
            return new DispatcherConfig(tickPeriod, dispatchMode, zone, daemonWorkers, workerThreadPrefix);
        }
    }
}

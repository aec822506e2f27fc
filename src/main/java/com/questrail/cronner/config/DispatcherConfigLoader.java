package com.questrail.cronner.config;

import com.questrail.cronner.dispatch.DispatchMode;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Properties;

/**
 * Loads DispatcherConfig from a properties file on the classpath.
 *
 * Optional keys (defaults from {@link DispatcherConfig#defaults()}):
 *  - cronner.tickPeriodMillis
 *  - cronner.dispatchMode        INLINE | THREADED
 *  - cronner.zone                any {@link ZoneId} id, e.g. UTC or Europe/Berlin
 *  - cronner.daemonWorkers       true | false
 *  - cronner.workerThreadPrefix
 */
public final class DispatcherConfigLoader {

    public static final String TICK_PERIOD_MILLIS = "cronner.tickPeriodMillis";
    public static final String DISPATCH_MODE = "cronner.dispatchMode";
    public static final String ZONE = "cronner.zone";
    public static final String DAEMON_WORKERS = "cronner.daemonWorkers";
    public static final String WORKER_THREAD_PREFIX = "cronner.workerThreadPrefix";

    private DispatcherConfigLoader() {}

    public static DispatcherConfig loadFromClasspath(String fileName) {
        Properties props = new Properties();

        try (InputStream in = DispatcherConfigLoader.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                throw new IllegalStateException("Config file not found on classpath: " + fileName);
            }
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config: " + fileName, e);
        }

        return fromProperties(props);
    }

    /**
     * Builds a config from already-loaded properties. Unknown keys are ignored.
     *
     * @throws IllegalStateException if a present value cannot be parsed
     * @throws IllegalArgumentException if the parsed values are out of range
     */
    public static DispatcherConfig fromProperties(Properties props) {
        DispatcherConfig.Builder builder = DispatcherConfig.builder();

        String tickMillis = getOptional(props, TICK_PERIOD_MILLIS);
        if (tickMillis != null) {
            builder.withTickPeriod(Duration.ofMillis(parseLong(TICK_PERIOD_MILLIS, tickMillis)));
        }

        String mode = getOptional(props, DISPATCH_MODE);
        if (mode != null) {
            try {
                builder.withDispatchMode(DispatchMode.valueOf(mode.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid value for " + DISPATCH_MODE + ": " + mode, e);
            }
        }

        String zone = getOptional(props, ZONE);
        if (zone != null) {
            try {
                builder.withZone(ZoneId.of(zone));
            } catch (DateTimeException e) {
                throw new IllegalStateException("Invalid value for " + ZONE + ": " + zone, e);
            }
        }

        String daemon = getOptional(props, DAEMON_WORKERS);
        if (daemon != null) {
            if (!daemon.equalsIgnoreCase("true") && !daemon.equalsIgnoreCase("false")) {
                throw new IllegalStateException("Invalid value for " + DAEMON_WORKERS + ": " + daemon);
            }
            builder.withDaemonWorkers(Boolean.parseBoolean(daemon));
        }

        String prefix = getOptional(props, WORKER_THREAD_PREFIX);
        if (prefix != null) {
            builder.withWorkerThreadPrefix(prefix);
        }

        return builder.build();
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static String getOptional(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null) return null;
        value = value.trim();
        return value.isEmpty() ? null : value;
    }
}

package com.questrail.cronner.config;

import com.questrail.cronner.dispatch.DispatchMode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherConfigLoaderTest {

    @Test
    void loadsEveryKeyFromClasspathFile() {
        DispatcherConfig config = DispatcherConfigLoader.loadFromClasspath("cronner-test.properties");

        assertEquals(Duration.ofMillis(250), config.tickPeriod());
        assertEquals(DispatchMode.INLINE, config.dispatchMode());
        assertEquals(ZoneId.of("Europe/Berlin"), config.zone());
        assertTrue(config.daemonWorkers());
        assertEquals("report-worker", config.workerThreadPrefix());
    }

    @Test
    void missingFileFailsWithItsName() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> DispatcherConfigLoader.loadFromClasspath("no-such-cronner.properties"));

        assertTrue(e.getMessage().contains("no-such-cronner.properties"));
    }

    @Test
    void unparsableTickPeriodNamesTheKey() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> DispatcherConfigLoader.loadFromClasspath("cronner-invalid-tick.properties"));

        assertTrue(e.getMessage().contains(DispatcherConfigLoader.TICK_PERIOD_MILLIS));
    }

    @Test
    void absentAndBlankKeysKeepDefaults() {
        Properties props = new Properties();
        props.setProperty(DispatcherConfigLoader.ZONE, "   ");

        DispatcherConfig config = DispatcherConfigLoader.fromProperties(props);

        assertEquals(DispatcherConfig.defaults(), config);
    }

    @Test
    void unknownKeysAreIgnored() {
        Properties props = new Properties();
        props.setProperty("cronner.somethingElse", "42");
        props.setProperty(DispatcherConfigLoader.DISPATCH_MODE, "Threaded");

        DispatcherConfig config = DispatcherConfigLoader.fromProperties(props);

        assertEquals(DispatchMode.THREADED, config.dispatchMode());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalStateException.class, () -> load(DispatcherConfigLoader.DISPATCH_MODE, "parallel"));
        assertThrows(IllegalStateException.class, () -> load(DispatcherConfigLoader.ZONE, "Mars/Olympus"));
        assertThrows(IllegalStateException.class, () -> load(DispatcherConfigLoader.DAEMON_WORKERS, "yes"));
    }

    @Test
    void outOfRangeTickPeriodIsRejectedByConfig() {
        assertThrows(IllegalArgumentException.class, () -> load(DispatcherConfigLoader.TICK_PERIOD_MILLIS, "5000"));
        assertThrows(IllegalArgumentException.class, () -> load(DispatcherConfigLoader.TICK_PERIOD_MILLIS, "0"));
    }

    private static DispatcherConfig load(String key, String value) {
        Properties props = new Properties();
        props.setProperty(key, value);
        return DispatcherConfigLoader.fromProperties(props);
    }
}

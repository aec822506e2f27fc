package com.questrail.cronner.internal.time;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Production {@link WallClock} backed by the system clock in a fixed zone.
 *
 * <p>Thread-safe.</p>
 */
public final class SystemWallClock implements WallClock {

    private final Clock clock;

    public SystemWallClock(ZoneId zone) {
        this.clock = Clock.system(Objects.requireNonNull(zone, "zone"));
    }

    public ZoneId zone() {
        return clock.getZone();
    }

    @Override
    public ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }
}

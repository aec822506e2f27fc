package com.questrail.cronner.time;

import com.questrail.cronner.internal.time.WallClock;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Wall clock for tests that can be set or advanced instantly (no sleeping).
 */
public final class ManualWallClock implements WallClock {

    private volatile ZonedDateTime now;

    public ManualWallClock(ZonedDateTime start) {
        this.now = Objects.requireNonNull(start, "start");
    }

    @Override
    public ZonedDateTime now() {
        return now;
    }

    public void set(ZonedDateTime instant) {
        this.now = Objects.requireNonNull(instant, "instant");
    }

    public void advance(Duration delta) {
        now = now.plus(delta);
    }
}

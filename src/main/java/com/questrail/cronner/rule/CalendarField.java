package com.questrail.cronner.rule;

import java.time.ZonedDateTime;
import java.util.function.ToIntFunction;

/**
 * A calendar component of the current instant that a {@link CalendarConstraint}
 * may restrict, together with its valid domain.
 */
public enum CalendarField {
    DAY_OF_MONTH("day-of-month", 1, 31, ZonedDateTime::getDayOfMonth),
    HOUR_OF_DAY("hour-of-day", 0, 23, ZonedDateTime::getHour),
    MINUTE_OF_HOUR("minute-of-hour", 0, 59, ZonedDateTime::getMinute),
    SECOND_OF_MINUTE("second-of-minute", 0, 59, ZonedDateTime::getSecond),
    /**
     * ISO day of week, Monday = 1 through Sunday = 7, as
     * {@link java.time.DayOfWeek#getValue()}. Zero-based weekday numbering
     * (Monday = 0) is not accepted; shift such values up by one.
     */
    DAY_OF_WEEK("day-of-week", 1, 7, t -> t.getDayOfWeek().getValue());

    private final String displayName;
    private final int min;
    private final int max;
    private final ToIntFunction<ZonedDateTime> extractor;

    CalendarField(String displayName, int min, int max, ToIntFunction<ZonedDateTime> extractor) {
        this.displayName = displayName;
        this.min = min;
        this.max = max;
        this.extractor = extractor;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public boolean inDomain(int value) {
        return value >= min && value <= max;
    }

    /**
     * Extracts this field's component from {@code instant}.
     */
    public int valueOf(ZonedDateTime instant) {
        return extractor.applyAsInt(instant);
    }

    @Override
    public String toString() {
        return displayName;
    }
}

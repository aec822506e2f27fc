package com.questrail.cronner.rule;

/**
 * Indicates that an {@link Interval} could not be constructed.
 *
 * This typically reflects:
 * <ul>
 *   <li>A count below one</li>
 *   <li>A missing {@link IntervalUnit}</li>
 *   <li>A rule builder asked for two different cadences</li>
 * </ul>
 *
 * Always raised synchronously at construction time, never from the tick loop.
 */
public final class InvalidIntervalException extends IllegalArgumentException
{
    public InvalidIntervalException(String message) {
        super(message);
    }
}

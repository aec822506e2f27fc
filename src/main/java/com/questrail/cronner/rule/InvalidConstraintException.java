package com.questrail.cronner.rule;

/**
 * Indicates that a {@link CalendarConstraint} could not be constructed, or that
 * a {@link Rule} was given two constraints for the same {@link CalendarField}.
 *
 * Always raised synchronously at construction time, never from the tick loop.
 */
public final class InvalidConstraintException extends IllegalArgumentException
{
    public InvalidConstraintException(String message) {
        super(message);
    }
}

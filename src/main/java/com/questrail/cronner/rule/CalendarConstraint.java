package com.questrail.cronner.rule;

import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * CalendarConstraint
 * =============================================================================
 * Restricts one {@link CalendarField} of the current instant to an accepted set
 * of values.
 *
 * <h2>Shapes</h2>
 * <ul>
 *   <li>{@link #exactly(CalendarField, int)}: a single accepted value</li>
 *   <li>{@link #between(CalendarField, int, int)}: an inclusive range</li>
 *   <li>{@link #anyOf(CalendarField, int...)}: an explicit set of values</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * Every value and bound lies within the field's domain, and a range has
 * {@code lower <= upper}. Wrapping ranges such as hours 22 to 2 are rejected;
 * express them as {@link #anyOf(CalendarField, int...)} instead.
 *
 * <p>Instances are immutable and validated on construction, so the tick loop
 * never observes a malformed constraint.</p>
 */
public final class CalendarConstraint
{
    private final CalendarField field;
    private final int lower;
    private final int upper;
    private final SortedSet<Integer> values;

    private CalendarConstraint(CalendarField field, int lower, int upper, SortedSet<Integer> values) {
        this.field = field;
        this.lower = lower;
        this.upper = upper;
        this.values = values;
    }

    /**
     * Accepts a single value of {@code field}.
     *
     * @throws InvalidConstraintException if {@code value} is outside the field's domain
     */
    public static CalendarConstraint exactly(CalendarField field, int value) {
        return between(field, value, value);
    }

    /**
     * Accepts the inclusive range {@code [lower, upper]} of {@code field}.
     *
     * @throws InvalidConstraintException if a bound is outside the field's domain
     *                                    or {@code lower > upper}
     */
    public static CalendarConstraint between(CalendarField field, int lower, int upper) {
        requireField(field);
        requireInDomain(field, lower);
        requireInDomain(field, upper);
        if (lower > upper) {
            throw new InvalidConstraintException(
                    field + " range lower bound " + lower + " exceeds upper bound " + upper);
        }
        return new CalendarConstraint(field, lower, upper, null);
    }

    /**
     * Accepts any of the listed values of {@code field}.
     *
     * @throws InvalidConstraintException if no value is given or one is outside
     *                                    the field's domain
     */
    public static CalendarConstraint anyOf(CalendarField field, int... values) {
        requireField(field);
        if (values == null || values.length == 0) {
            throw new InvalidConstraintException(field + " requires at least one value");
        }
        SortedSet<Integer> accepted = new TreeSet<>();
        for (int value : values) {
            requireInDomain(field, value);
            accepted.add(value);
        }
        if (accepted.size() == 1) {
            int only = accepted.first();
            return new CalendarConstraint(field, only, only, null);
        }
        return new CalendarConstraint(field, accepted.first(), accepted.last(),
                Collections.unmodifiableSortedSet(accepted));
    }

    public CalendarField field() {
        return field;
    }

    /**
     * Returns true if {@code value} is accepted by this constraint.
     */
    public boolean accepts(int value) {
        if (values != null) {
            return values.contains(value);
        }
        return value >= lower && value <= upper;
    }

    /**
     * Returns true if the component of {@code now} named by {@link #field()}
     * is accepted.
     */
    public boolean matches(ZonedDateTime now) {
        return accepts(field.valueOf(now));
    }

    private static void requireField(CalendarField field) {
        if (field == null) {
            throw new InvalidConstraintException("constraint field must be one of " + Arrays.toString(CalendarField.values()));
        }
    }

    private static void requireInDomain(CalendarField field, int value) {
        if (!field.inDomain(value)) {
            throw new InvalidConstraintException(
                    field + " value " + value + " is outside " + field.min() + "-" + field.max());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalendarConstraint)) return false;
        CalendarConstraint that = (CalendarConstraint) o;
        return lower == that.lower
                && upper == that.upper
                && field == that.field
                && Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, lower, upper, values);
    }

    @Override
    public String toString() {
        if (values != null) {
            return field + " in " + values.stream().map(String::valueOf).collect(Collectors.joining(",", "{", "}"));
        }
        if (lower == upper) {
            return field + " = " + lower;
        }
        return field + " in [" + lower + ", " + upper + "]";
    }
}

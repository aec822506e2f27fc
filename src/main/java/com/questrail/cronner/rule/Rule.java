package com.questrail.cronner.rule;

import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rule
 * =============================================================================
 * Immutable recurrence rule: an {@link Interval} cadence, optionally further
 * restricted by {@link CalendarConstraint}s keyed by distinct
 * {@link CalendarField}s.
 *
 * <h2>Due-time computation</h2>
 * A job is due at {@code now} iff it is both:
 * <ul>
 *   <li><b>cadence-due</b>: it never fired, or {@code now} is at or after
 *       {@code lastFired + interval} (calendar-aware addition)</li>
 *   <li><b>calendar-eligible</b>: every constrained field of {@code now} is
 *       accepted by its constraint</li>
 * </ul>
 *
 * <p>The two checks are independent. Evaluating a rule outside its calendar
 * window never resets the cadence; only an actual fire moves
 * {@code lastFired}. A job "every 5 minutes, hours 8-10" therefore fires on
 * the next cadence boundary that also lies inside the window, which may be
 * many cadence periods after the previous fire.</p>
 *
 * <h2>Construction</h2>
 * <pre>
 *   Rule rule = Rule.every(5, IntervalUnit.MINUTE)
 *           .between(CalendarField.HOUR_OF_DAY, 8, 10)
 *           .build();
 * </pre>
 * All validation happens while building; a constructed rule is always valid.
 */
public final class Rule
{
    private final Interval interval;
    private final Map<CalendarField, CalendarConstraint> constraints;

    private Rule(Interval interval, Map<CalendarField, CalendarConstraint> constraints) {
        this.interval = Objects.requireNonNull(interval, "interval");
        this.constraints = Collections.unmodifiableMap(new EnumMap<>(constraints));
    }

    /**
     * Rule with the given cadence and no calendar constraints.
     */
    public static Rule of(Interval interval) {
        return new Rule(interval, new EnumMap<>(CalendarField.class));
    }

    /**
     * Starts a builder with the cadence "every {@code count} {@code unit}s".
     *
     * @throws InvalidIntervalException if the cadence is invalid
     */
    public static Builder every(int count, IntervalUnit unit) {
        return builder().every(count, unit);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Interval interval() {
        return interval;
    }

    public Collection<CalendarConstraint> constraints() {
        return constraints.values();
    }

    public Optional<CalendarConstraint> constraint(CalendarField field) {
        return Optional.ofNullable(constraints.get(field));
    }

    /**
     * Returns the first instant at which the cadence has elapsed, or empty if
     * the job never fired and is therefore immediately eligible.
     */
    public Optional<ZonedDateTime> nextCadenceInstant(Optional<ZonedDateTime> lastFired) {
        return lastFired.map(interval::after);
    }

    public boolean isCadenceDue(ZonedDateTime now, Optional<ZonedDateTime> lastFired) {
        Objects.requireNonNull(now, "now");
        return nextCadenceInstant(lastFired)
                .map(next -> !now.toInstant().isBefore(next.toInstant()))
                .orElse(true);
    }

    public boolean isCalendarEligible(ZonedDateTime now) {
        Objects.requireNonNull(now, "now");
        for (CalendarConstraint constraint : constraints.values()) {
            if (!constraint.matches(now)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Answers "is the job due now?".
     *
     * @param now       the instant observed by the current tick
     * @param lastFired the tick instant of the job's previous fire, if any
     * @return true iff the job is cadence-due and calendar-eligible
     */
    public boolean isDue(ZonedDateTime now, Optional<ZonedDateTime> lastFired) {
        return isCadenceDue(now, lastFired) && isCalendarEligible(now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rule)) return false;
        Rule rule = (Rule) o;
        return interval.equals(rule.interval) && constraints.equals(rule.constraints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(interval, constraints);
    }

    @Override
    public String toString() {
        if (constraints.isEmpty()) {
            return interval.toString();
        }
        return interval + " where " + constraints.values().stream()
                .map(CalendarConstraint::toString)
                .collect(Collectors.joining(" and "));
    }

    /**
     * Fluent accumulator for a {@link Rule}. Not thread-safe; each call
     * validates its arguments immediately.
     */
    public static final class Builder {
        private Interval interval;
        private final Map<CalendarField, CalendarConstraint> constraints = new EnumMap<>(CalendarField.class);

        private Builder() {}

        /**
         * Sets the cadence. May be called again with the same unit to change
         * the count.
         *
         * @throws InvalidIntervalException if the cadence is invalid or a
         *                                  different unit was already set
         */
        public Builder every(int count, IntervalUnit unit) {
            Interval candidate = new Interval(unit, count);
            if (interval != null && interval.unit() != unit) {
                throw new InvalidIntervalException(
                        "interval already set to " + interval + "; cannot change unit to " + unit);
            }
            this.interval = candidate;
            return this;
        }

        /**
         * Restricts {@code field} to a single value.
         */
        public Builder on(CalendarField field, int value) {
            return constrain(CalendarConstraint.exactly(field, value));
        }

        /**
         * Restricts {@code field} to the inclusive range {@code [lower, upper]}.
         */
        public Builder between(CalendarField field, int lower, int upper) {
            return constrain(CalendarConstraint.between(field, lower, upper));
        }

        /**
         * Restricts {@code field} to any of {@code values}.
         */
        public Builder anyOf(CalendarField field, int... values) {
            return constrain(CalendarConstraint.anyOf(field, values));
        }

        /**
         * Adds a prebuilt constraint.
         *
         * @throws InvalidConstraintException if the field is already constrained
         */
        public Builder constrain(CalendarConstraint constraint) {
            Objects.requireNonNull(constraint, "constraint");
            if (constraints.containsKey(constraint.field())) {
                throw new InvalidConstraintException(
                        constraint.field() + " is already constrained by " + constraints.get(constraint.field()));
            }
            constraints.put(constraint.field(), constraint);
            return this;
        }

        /**
         * @throws InvalidIntervalException if no cadence was set
         */
        public Rule build() {
            if (interval == null) {
                throw new InvalidIntervalException("rule requires an interval; call every(count, unit)");
            }
            return new Rule(interval, constraints);
        }
    }
}

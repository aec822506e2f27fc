package com.questrail.cronner.rule;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RuleTest {

    private static final ZonedDateTime MIDNIGHT = ZonedDateTime.of(2024, 5, 6, 0, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void neverFiredJobIsImmediatelyDue() {
        Rule rule = Rule.every(1, IntervalUnit.MONTH).build();

        assertTrue(rule.isDue(MIDNIGHT, Optional.empty()));
        assertEquals(Optional.empty(), rule.nextCadenceInstant(Optional.empty()));
    }

    @Test
    void dueExactlyOnceCadenceHasElapsedForEveryUnit() {
        ZonedDateTime lastFired = ZonedDateTime.of(2024, 1, 31, 12, 0, 0, 0, ZoneOffset.UTC);

        for (IntervalUnit unit : IntervalUnit.values()) {
            for (int count = 1; count <= 3; count++) {
                Rule rule = Rule.every(count, unit).build();
                ZonedDateTime boundary = unit.addTo(lastFired, count);

                assertFalse(rule.isDue(boundary.minusSeconds(1), Optional.of(lastFired)),
                        "every " + count + " " + unit + " must not be due before boundary");
                assertTrue(rule.isDue(boundary, Optional.of(lastFired)),
                        "every " + count + " " + unit + " must be due at boundary");
                assertTrue(rule.isDue(boundary.plusHours(1), Optional.of(lastFired)),
                        "every " + count + " " + unit + " must stay due after boundary");
            }
        }
    }

    @Test
    void cadenceComparesInstantsAcrossZones() {
        Rule rule = Rule.every(1, IntervalUnit.HOUR).build();
        ZonedDateTime lastFired = MIDNIGHT;
        ZonedDateTime oneHourLaterInBerlin = MIDNIGHT.plusHours(1).withZoneSameInstant(ZoneId.of("Europe/Berlin"));

        assertTrue(rule.isCadenceDue(oneHourLaterInBerlin, Optional.of(lastFired)));
    }

    @Test
    void calendarConstraintsAreConjunctive() {
        Rule rule = Rule.every(1, IntervalUnit.MINUTE)
                .between(CalendarField.HOUR_OF_DAY, 8, 10)
                .on(CalendarField.DAY_OF_MONTH, 6)
                .build();

        assertTrue(rule.isCalendarEligible(MIDNIGHT.withHour(9)));
        assertFalse(rule.isCalendarEligible(MIDNIGHT.withHour(11)));
        assertFalse(rule.isCalendarEligible(MIDNIGHT.withHour(9).plusDays(1)));
    }

    @Test
    void outsideWindowIsNotDueEvenWhenCadenceElapsed() {
        Rule rule = Rule.every(5, IntervalUnit.MINUTE)
                .between(CalendarField.HOUR_OF_DAY, 8, 10)
                .build();

        assertFalse(rule.isDue(MIDNIGHT.withHour(7).withMinute(55), Optional.empty()));
        assertTrue(rule.isDue(MIDNIGHT.withHour(8), Optional.empty()));
    }

    @Test
    void fireInstantsOverADayAreCadenceBoundariesInsideHourWindow() {
        Rule rule = Rule.every(5, IntervalUnit.MINUTE)
                .between(CalendarField.HOUR_OF_DAY, 8, 10)
                .build();

        List<ZonedDateTime> fires = new ArrayList<>();
        Optional<ZonedDateTime> lastFired = Optional.empty();
        for (ZonedDateTime t = MIDNIGHT; t.isBefore(MIDNIGHT.plusDays(1)); t = t.plusSeconds(1)) {
            if (rule.isDue(t, lastFired)) {
                fires.add(t);
                lastFired = Optional.of(t);
            }
        }

        assertEquals(36, fires.size());
        for (int i = 0; i < fires.size(); i++) {
            assertEquals(MIDNIGHT.withHour(8).plusMinutes(5L * i), fires.get(i));
        }
        assertTrue(fires.stream().allMatch(t -> t.getHour() >= 8 && t.getHour() <= 10));
    }

    @Test
    void cadenceLongerThanWindowFiresAtNextWindowOpening() {
        Rule rule = Rule.every(2, IntervalUnit.HOUR)
                .on(CalendarField.HOUR_OF_DAY, 9)
                .build();
        ZonedDateTime firstFire = MIDNIGHT.withHour(9);

        // cadence boundary 11:00 falls outside the window; nothing fires until 09:00 next day
        assertFalse(rule.isDue(MIDNIGHT.withHour(11), Optional.of(firstFire)));
        assertFalse(rule.isDue(MIDNIGHT.withHour(23).withMinute(59), Optional.of(firstFire)));
        assertTrue(rule.isDue(firstFire.plusDays(1), Optional.of(firstFire)));
    }

    @Test
    void checksOutsideWindowDoNotResetCadence() {
        Rule rule = Rule.every(5, IntervalUnit.MINUTE)
                .between(CalendarField.MINUTE_OF_HOUR, 0, 30)
                .build();
        ZonedDateTime lastFired = MIDNIGHT.withHour(1).withMinute(30);

        assertFalse(rule.isDue(lastFired.plusMinutes(5), Optional.of(lastFired)));
        assertFalse(rule.isDue(lastFired.plusMinutes(20), Optional.of(lastFired)));
        assertTrue(rule.isDue(lastFired.plus(Duration.ofMinutes(30)), Optional.of(lastFired)));
    }

    @Test
    void unconstrainedRuleIsDueOnCadenceAlone() {
        Rule rule = Rule.of(Interval.every(90, IntervalUnit.SECOND));

        assertTrue(rule.constraints().isEmpty());
        assertFalse(rule.isDue(MIDNIGHT.plusSeconds(89), Optional.of(MIDNIGHT)));
        assertTrue(rule.isDue(MIDNIGHT.plusSeconds(90), Optional.of(MIDNIGHT)));
        assertEquals(Rule.every(90, IntervalUnit.SECOND).build(), rule);
    }

    @Test
    void constraintIsLookedUpByField() {
        Rule rule = Rule.every(1, IntervalUnit.MINUTE)
                .anyOf(CalendarField.DAY_OF_WEEK, 1, 3, 5)
                .build();

        CalendarConstraint weekdays = rule.constraint(CalendarField.DAY_OF_WEEK).orElseThrow();
        assertEquals(CalendarConstraint.anyOf(CalendarField.DAY_OF_WEEK, 1, 3, 5), weekdays);
        assertTrue(rule.constraint(CalendarField.HOUR_OF_DAY).isEmpty());
    }

    @Test
    void builderRejectsSecondConstraintOnSameField() {
        Rule.Builder builder = Rule.every(1, IntervalUnit.MINUTE).on(CalendarField.HOUR_OF_DAY, 8);

        assertThrows(InvalidConstraintException.class, () -> builder.between(CalendarField.HOUR_OF_DAY, 9, 10));
    }

    @Test
    void builderRejectsChangingIntervalUnit() {
        Rule.Builder builder = Rule.every(1, IntervalUnit.MINUTE);

        assertThrows(InvalidIntervalException.class, () -> builder.every(1, IntervalUnit.HOUR));
    }

    @Test
    void builderAllowsChangingCountForSameUnit() {
        Rule rule = Rule.every(1, IntervalUnit.MINUTE).every(10, IntervalUnit.MINUTE).build();

        assertEquals(Interval.every(10, IntervalUnit.MINUTE), rule.interval());
    }

    @Test
    void builderWithoutIntervalIsRejected() {
        assertThrows(InvalidIntervalException.class,
                () -> Rule.builder().on(CalendarField.HOUR_OF_DAY, 3).build());
    }

    @Test
    void builtRuleIsUnaffectedByLaterBuilderCalls() {
        Rule.Builder builder = Rule.every(1, IntervalUnit.MINUTE);
        Rule rule = builder.build();
        builder.on(CalendarField.HOUR_OF_DAY, 3);

        assertTrue(rule.constraints().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> rule.constraints().clear());
    }

    @Test
    void equalRulesCompareEqual() {
        Rule a = Rule.every(5, IntervalUnit.MINUTE).between(CalendarField.HOUR_OF_DAY, 8, 10).build();
        Rule b = Rule.builder().between(CalendarField.HOUR_OF_DAY, 8, 10).every(5, IntervalUnit.MINUTE).build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("every 5 minutes where hour-of-day in [8, 10]", a.toString());
    }
}

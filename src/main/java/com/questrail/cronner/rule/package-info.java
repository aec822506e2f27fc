/**
 * Recurrence rules
 * =============================================================================
 *
 * A {@link com.questrail.cronner.rule.Rule} combines one interval cadence with
 * zero or more calendar constraints. Rules are immutable values; the only
 * state a due-time decision needs besides the rule is the job's last fire
 * instant, which the caller passes in.
 *
 * <h2>Due</h2>
 * A rule is due at {@code now} when both hold:
 * <ul>
 *   <li>the cadence has elapsed: the job never fired, or
 *       {@code lastFired + interval <= now}</li>
 *   <li>every constraint accepts the matching calendar field of {@code now}</li>
 * </ul>
 *
 * <p>Calendar fields are read in the zone of the {@code ZonedDateTime} passed
 * in; cadence is compared on instants.</p>
 */
package com.questrail.cronner.rule;

package com.fightsight.analysis.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget of one pipeline run.
 *
 * @param expiresAt  no classifier call is dispatched after this instant
 * @param budget     the configured session budget, for reporting
 * @param drainGrace how long calls already in flight may keep running past {@code expiresAt}
 */
public record SessionDeadline(Instant expiresAt, Duration budget, Duration drainGrace) {

    public static SessionDeadline startingAt(Instant start, Duration budget, Duration drainGrace) {
        return new SessionDeadline(start.plus(budget), budget, drainGrace);
    }

    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(expiresAt);
    }

    /** Time an in-flight call may still take: what is left of the budget plus the grace. */
    public Duration callAllowance(Clock clock) {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return (left.isNegative() ? Duration.ZERO : left).plus(drainGrace);
    }
}

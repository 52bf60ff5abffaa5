package com.fightsight.analysis.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class SessionDeadlineTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("call allowance is the remaining budget plus the drain grace")
    void allowance_beforeExpiry() {
        SessionDeadline deadline = SessionDeadline.startingAt(START, Duration.ofSeconds(60), Duration.ofSeconds(5));
        Clock clock = Clock.fixed(START.plusSeconds(20), ZoneOffset.UTC);

        assertFalse(deadline.isExpired(clock));
        assertEquals(Duration.ofSeconds(45), deadline.callAllowance(clock));
    }

    @Test
    @DisplayName("past the deadline only the drain grace is left")
    void allowance_afterExpiry() {
        SessionDeadline deadline = SessionDeadline.startingAt(START, Duration.ofSeconds(60), Duration.ofSeconds(5));
        Clock clock = Clock.fixed(START.plusSeconds(90), ZoneOffset.UTC);

        assertTrue(deadline.isExpired(clock));
        assertEquals(Duration.ofSeconds(5), deadline.callAllowance(clock));
    }

    @Test
    @DisplayName("the deadline instant itself counts as expired")
    void exactDeadline_isExpired() {
        SessionDeadline deadline = SessionDeadline.startingAt(START, Duration.ofSeconds(60), Duration.ZERO);

        assertTrue(deadline.isExpired(Clock.fixed(START.plusSeconds(60), ZoneOffset.UTC)));
    }
}

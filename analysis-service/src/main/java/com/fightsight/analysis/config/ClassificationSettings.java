package com.fightsight.analysis.config;

import java.time.Duration;

/**
 * Per-session classification fan-out and retry policy.
 *
 * @param maxConcurrency in-flight classifier calls per session
 * @param maxAttempts    total attempts per candidate, first call included
 */
public record ClassificationSettings(
    int maxConcurrency,
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff
) {
    public ClassificationSettings {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1: " + maxConcurrency);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
    }
}

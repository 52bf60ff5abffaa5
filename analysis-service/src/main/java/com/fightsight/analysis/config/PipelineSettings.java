package com.fightsight.analysis.config;

import java.time.Duration;

/**
 * Session-level pipeline knobs.
 *
 * @param maxSessionDuration wall-clock budget of one run, measured from the move to PROCESSING
 * @param drainGrace         extra time in-flight classifier calls get once the budget is spent
 */
public record PipelineSettings(
    double combinationWindowSeconds,
    double counterWindowSeconds,
    Duration maxSessionDuration,
    Duration drainGrace,
    int maxConcurrentSessions
) {}

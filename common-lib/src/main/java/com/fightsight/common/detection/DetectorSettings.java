package com.fightsight.common.detection;

/**
 * Tuning for {@link StrikeCandidateDetector}.
 *
 * @param velocityThreshold per-frame displacement (normalised image units) a joint must exceed
 * @param minVisibility     landmarks below this visibility are ignored
 * @param refractorySeconds same-limb candidates closer than this collapse to the fastest one
 */
public record DetectorSettings(
    double velocityThreshold,
    double minVisibility,
    double refractorySeconds
) {
    public static final double DEFAULT_VELOCITY_THRESHOLD = 0.05;
    public static final double DEFAULT_MIN_VISIBILITY     = 0.5;
    public static final double DEFAULT_REFRACTORY_SECONDS = 0.3;

    public DetectorSettings {
        if (!(velocityThreshold > 0.0)) {
            throw new IllegalArgumentException("velocityThreshold must be positive: " + velocityThreshold);
        }
        if (minVisibility < 0.0 || minVisibility > 1.0) {
            throw new IllegalArgumentException("minVisibility must be within [0, 1]: " + minVisibility);
        }
        if (refractorySeconds < 0.0) {
            throw new IllegalArgumentException("refractorySeconds must not be negative: " + refractorySeconds);
        }
    }

    public static DetectorSettings defaults() {
        return new DetectorSettings(DEFAULT_VELOCITY_THRESHOLD, DEFAULT_MIN_VISIBILITY, DEFAULT_REFRACTORY_SECONDS);
    }
}

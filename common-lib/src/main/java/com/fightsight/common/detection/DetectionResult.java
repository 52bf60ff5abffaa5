package com.fightsight.common.detection;

import com.fightsight.common.model.StrikeCandidate;

import java.util.List;

/**
 * @param candidates     collapsed candidates in canonical order
 * @param framesAnalyzed frames that passed validation
 * @param framesSkipped  malformed frames that were dropped
 */
public record DetectionResult(
    List<StrikeCandidate> candidates,
    int framesAnalyzed,
    int framesSkipped
) {
    public DetectionResult {
        candidates = List.copyOf(candidates);
    }

    public static DetectionResult empty() {
        return new DetectionResult(List.of(), 0, 0);
    }

    public int totalFrames() {
        return framesAnalyzed + framesSkipped;
    }
}

package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.client.dto.ClassificationResponse;
import com.fightsight.common.model.StrikeCandidate;

/**
 * What became of one candidate.
 *
 * @param response  classifier verdict; {@code null} when the candidate failed
 * @param attempts  classifier calls spent on the candidate (0 if never dispatched)
 */
public record ClassificationOutcome(
    StrikeCandidate candidate,
    Status status,
    ClassificationResponse response,
    int attempts,
    String failureReason
) {
    public enum Status {
        CONFIRMED,
        FALSE_POSITIVE,
        FAILED
    }

    public static ClassificationOutcome of(StrikeCandidate candidate, ClassificationResponse response, int attempts) {
        Status status = response.strikeDetected() ? Status.CONFIRMED : Status.FALSE_POSITIVE;
        return new ClassificationOutcome(candidate, status, response, attempts, null);
    }

    public static ClassificationOutcome failed(StrikeCandidate candidate, int attempts, String reason) {
        return new ClassificationOutcome(candidate, Status.FAILED, null, attempts, reason);
    }

    public boolean isConfirmed() {
        return status == Status.CONFIRMED;
    }
}

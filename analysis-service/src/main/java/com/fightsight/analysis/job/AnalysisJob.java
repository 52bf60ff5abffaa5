package com.fightsight.analysis.job;

/**
 * A queued request to run one session.
 *
 * @param framesLocation optional override of the session's stored frames location
 */
public record AnalysisJob(Long sessionId, String framesLocation) {
}

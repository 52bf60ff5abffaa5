package com.fightsight.common.lifecycle;

import com.fightsight.common.exception.IllegalSessionTransitionException;
import com.fightsight.common.model.AnalysisStatus;

/**
 * Deterministic status and progress rules for an analysis session.
 *
 * <pre>
 *   PENDING → PROCESSING → { COMPLETED, FAILED }
 * </pre>
 *
 * <p>Invariant:
 * - Nothing leaves a terminal status.
 * - Progress never decreases, and 100 is reserved for the COMPLETED transition.
 */
public final class SessionStateMachine {

    public static final int COMPLETE_PERCENTAGE    = 100;
    public static final int MAX_IN_FLIGHT_PROGRESS = 99;

    private SessionStateMachine() {}

    public static boolean canTransition(AnalysisStatus from, AnalysisStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return switch (from) {
            case PENDING    -> to == AnalysisStatus.PROCESSING;
            case PROCESSING -> to == AnalysisStatus.COMPLETED || to == AnalysisStatus.FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /**
     * @return {@code to}, when the transition is legal
     * @throws IllegalSessionTransitionException otherwise
     */
    public static AnalysisStatus transition(Long sessionId, AnalysisStatus from, AnalysisStatus to) {
        if (!canTransition(from, to)) {
            throw new IllegalSessionTransitionException(sessionId, from, to);
        }
        return to;
    }

    /**
     * Progress after {@code stage} finishes, never below {@code current} and never 100
     * (only {@link #COMPLETE_PERCENTAGE completion} reaches 100).
     */
    public static int advanceProgress(int current, PipelineStage stage) {
        int target = Math.min(stage.cumulativePercentage(), MAX_IN_FLIGHT_PROGRESS);
        return Math.max(current, target);
    }
}

package com.fightsight.common.exception;

/**
 * A derived-record invariant was broken (duplicate combination position, orphaned
 * reference). Indicates a logic defect; surfaced, never repaired.
 */
public class IntegrityViolationException extends PipelineException {

    public IntegrityViolationException(Long sessionId, String message) {
        super(sessionId, message);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}

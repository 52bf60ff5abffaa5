package com.fightsight.common.exception;

/**
 * Malformed frame or candidate data. The offending item is skipped; the run continues.
 */
public class ValidationException extends PipelineException {

    public ValidationException(Long sessionId, String message) {
        super(sessionId, message);
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}

package com.fightsight.common.exception;

/**
 * Authentication failure, exhausted quota or a response that cannot be interpreted.
 * Aborts the session immediately.
 */
public class FatalProviderException extends PipelineException {

    public FatalProviderException(Long sessionId, String message) {
        super(sessionId, message);
    }

    public FatalProviderException(Long sessionId, String message, Throwable cause) {
        super(sessionId, message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}

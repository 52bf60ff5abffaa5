package com.fightsight.common.exception;

/**
 * Root of the analysis pipeline's error taxonomy. Carries the owning session id
 * so that any stage's failure can be attributed without extra context.
 *
 * <p>{@link #isFatal()} decides whether the failure moves the session to {@code FAILED}.
 */
public abstract class PipelineException extends RuntimeException {

    private final Long sessionId;

    protected PipelineException(Long sessionId, String message) {
        super("[session=" + sessionId + "] " + message);
        this.sessionId = sessionId;
    }

    protected PipelineException(Long sessionId, String message, Throwable cause) {
        super("[session=" + sessionId + "] " + message, cause);
        this.sessionId = sessionId;
    }

    public Long getSessionId() {
        return sessionId;
    }

    public abstract boolean isFatal();
}

package com.fightsight.common.exception;

/**
 * Timeout, rate limiting or a server-side hiccup at an external provider. Retried with backoff.
 */
public class TransientProviderException extends PipelineException {

    public TransientProviderException(Long sessionId, String message) {
        super(sessionId, message);
    }

    public TransientProviderException(Long sessionId, String message, Throwable cause) {
        super(sessionId, message, cause);
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}

package com.fightsight.analysis.client;

import com.fightsight.common.exception.FatalProviderException;
import com.fightsight.common.exception.PipelineException;
import com.fightsight.common.exception.TransientProviderException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Maps collaborator failures onto the pipeline's error taxonomy.
 *
 * <pre>
 *   HTTP 408 / 429 / 5xx, timeouts, connection failures → TransientProviderException
 *   HTTP 401 / 402 / 403 and any other 4xx              → FatalProviderException
 *   undecodable or malformed body                       → FatalProviderException
 * </pre>
 */
public final class ProviderErrors {

    private ProviderErrors() {}

    public static PipelineException translate(Long sessionId, String provider, Throwable error) {
        if (error instanceof PipelineException) {
            return (PipelineException) error;
        }
        if (error instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) error).getStatusCode().value();
            if (status == 408 || status == 429 || status >= 500) {
                return new TransientProviderException(sessionId,
                    provider + " returned HTTP " + status, error);
            }
            return new FatalProviderException(sessionId,
                provider + " rejected the request with HTTP " + status, error);
        }
        if (error instanceof TimeoutException || error instanceof WebClientRequestException) {
            return new TransientProviderException(sessionId,
                provider + " unreachable: " + error.getMessage(), error);
        }
        if (error instanceof DecodingException || error instanceof JsonProcessingException) {
            return new FatalProviderException(sessionId,
                provider + " returned a malformed response: " + error.getMessage(), error);
        }
        return new FatalProviderException(sessionId,
            provider + " call failed: " + error.getMessage(), error);
    }
}

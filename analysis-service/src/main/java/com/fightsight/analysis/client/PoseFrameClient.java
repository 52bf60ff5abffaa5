package com.fightsight.analysis.client;

import com.fightsight.common.exception.FatalProviderException;
import com.fightsight.common.exception.TransientProviderException;
import com.fightsight.common.model.PoseFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;

/**
 * Fetches pose frames from the CV service:
 * {@code GET /api/v1/pose/{sessionId}/frames?location=...}.
 *
 * <p>Transient failures are retried a few times. Without frames the session cannot
 * proceed, so a failure that outlasts the retries is fatal.
 */
@Component
public class PoseFrameClient implements PoseFrameSource {

    private static final Logger log = LoggerFactory.getLogger(PoseFrameClient.class);

    private static final String PROVIDER     = "pose-source";
    private static final int    MAX_RETRIES  = 2;
    private static final Duration BACKOFF    = Duration.ofSeconds(1);

    private final WebClient webClient;

    public PoseFrameClient(@Qualifier("poseSourceWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public Mono<List<PoseFrame>> fetchFrames(Long sessionId, String framesLocation) {
        log.info("[PoseSource] Fetching frames. sessionId={} location={}", sessionId, framesLocation);
        return Mono.defer(() -> webClient.get()
                .uri(uri -> uri.path("/api/v1/pose/{sessionId}/frames")
                    .queryParam("location", framesLocation)
                    .build(sessionId))
                .retrieve()
                .bodyToFlux(PoseFrame.class)
                .collectList())
            .onErrorMap(e -> ProviderErrors.translate(sessionId, PROVIDER, e))
            .retryWhen(Retry.backoff(MAX_RETRIES, BACKOFF)
                .filter(TransientProviderException.class::isInstance)
                .onRetryExhaustedThrow((spec, signal) -> new FatalProviderException(sessionId,
                    "Pose source still failing after " + signal.totalRetries() + " retries", signal.failure())))
            .doOnSuccess(frames -> log.info("[PoseSource] Frames fetched. sessionId={} frames={}",
                                            sessionId, frames.size()))
            .doOnError(e -> log.error("[PoseSource] Frame fetch failed. sessionId={} reason={}",
                                      sessionId, e.getMessage()));
    }
}

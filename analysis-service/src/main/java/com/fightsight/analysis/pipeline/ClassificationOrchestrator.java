package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.client.StrikeClassifier;
import com.fightsight.analysis.client.dto.ClassificationRequest;
import com.fightsight.analysis.config.ClassificationSettings;
import com.fightsight.analysis.model.AnalysisSession;
import com.fightsight.common.combination.StrikeOrdering;
import com.fightsight.common.exception.PipelineTimeoutException;
import com.fightsight.common.exception.TransientProviderException;
import com.fightsight.common.model.StrikeCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans a session's candidates out to the classifier and gathers one
 * {@link ClassificationOutcome} per candidate.
 *
 * <p>Per candidate:
 * <pre>
 *   deadline passed?  → FAILED, not dispatched, run flagged as timed out
 *   rate-limit permit → classify → CONFIRMED | FALSE_POSITIVE
 *   TransientProviderException → Retry.backoff up to maxAttempts, then FAILED
 *   FatalProviderException     → propagates; the whole fan-out is cancelled
 * </pre>
 *
 * <p>At most {@code maxConcurrency} calls of one session are in flight. Outcomes are
 * re-sorted by candidate order once every call has finished, so completion order never
 * leaks into persistence. A run that hit the deadline ends with
 * {@link PipelineTimeoutException} after its in-flight calls have drained.
 */
@Component
public class ClassificationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ClassificationOrchestrator.class);

    static final String FRAME_IMAGE_PATTERN = "%s/frame_%06d.jpg";

    private static final Comparator<ClassificationOutcome> OUTCOME_ORDER =
        Comparator.comparing(ClassificationOutcome::candidate, StrikeOrdering.CANDIDATES);

    private final StrikeClassifier classifier;
    private final ProviderRateLimiter rateLimiter;
    private final ClassificationSettings settings;
    private final Clock clock;

    public ClassificationOrchestrator(StrikeClassifier classifier,
                                      ProviderRateLimiter classifierRateLimiter,
                                      ClassificationSettings settings,
                                      Clock clock) {
        this.classifier  = classifier;
        this.rateLimiter = classifierRateLimiter;
        this.settings    = settings;
        this.clock       = clock;
    }

    public Mono<ClassificationReport> classifyAll(AnalysisSession session,
                                                  List<StrikeCandidate> candidates,
                                                  SessionDeadline deadline,
                                                  ClassificationTally tally) {
        Long sessionId = session.getId();
        AtomicBoolean timedOut = new AtomicBoolean(false);

        List<StrikeCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(StrikeOrdering.CANDIDATES);

        log.info("[Classification] Dispatching candidates. sessionId={} candidates={} maxConcurrency={} provider={}",
                 sessionId, ordered.size(), settings.maxConcurrency(), rateLimiter.provider());

        return Flux.fromIterable(ordered)
            .flatMap(candidate -> classifyOne(session, candidate, deadline, tally, timedOut),
                     settings.maxConcurrency())
            .doOnNext(tally::recordOutcome)
            .collectList()
            .flatMap(outcomes -> {
                if (timedOut.get()) {
                    log.warn("[Classification] Session deadline reached. sessionId={} {}", sessionId, tally);
                    return Mono.error(new PipelineTimeoutException(sessionId, deadline.budget()));
                }
                List<ClassificationOutcome> sorted = new ArrayList<>(outcomes);
                sorted.sort(OUTCOME_ORDER);
                log.info("[Classification] Complete. sessionId={} {}", sessionId, tally);
                return Mono.just(new ClassificationReport(sorted, tally));
            });
    }

    private Mono<ClassificationOutcome> classifyOne(AnalysisSession session,
                                                    StrikeCandidate candidate,
                                                    SessionDeadline deadline,
                                                    ClassificationTally tally,
                                                    AtomicBoolean timedOut) {
        return Mono.defer(() -> {
            if (deadline.isExpired(clock)) {
                timedOut.set(true);
                return Mono.just(ClassificationOutcome.failed(candidate, 0, "not dispatched before session deadline"));
            }

            ClassificationRequest request = buildRequest(session, candidate);
            AtomicInteger attempts = new AtomicInteger();

            Mono<ClassificationOutcome> call = rateLimiter.acquire()
                .then(Mono.defer(() -> {
                    attempts.incrementAndGet();
                    tally.recordCall();
                    return classifier.classify(request);
                }))
                .retryWhen(Retry.backoff(settings.maxAttempts() - 1L, settings.initialBackoff())
                    .maxBackoff(settings.maxBackoff())
                    .filter(e -> e instanceof TransientProviderException && !deadline.isExpired(clock))
                    .doBeforeRetry(signal -> log.debug(
                        "[Classification] Retrying transient failure. sessionId={} frame={} attempt={} reason={}",
                        session.getId(), candidate.frameIndex(), signal.totalRetries() + 2,
                        signal.failure().getMessage()))
                    .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .map(response -> ClassificationOutcome.of(candidate, response, attempts.get()));

            return call
                .timeout(deadline.callAllowance(clock))
                .onErrorResume(e -> e instanceof TransientProviderException || e instanceof TimeoutException, e -> {
                    if (e instanceof TimeoutException || deadline.isExpired(clock)) {
                        timedOut.set(true);
                    }
                    log.warn("[Classification] Candidate failed. sessionId={} frame={} limb={} attempts={} reason={}",
                             session.getId(), candidate.frameIndex(), candidate.limb(), attempts.get(),
                             e.getMessage());
                    return Mono.just(ClassificationOutcome.failed(candidate, attempts.get(), e.getMessage()));
                });
        });
    }

    ClassificationRequest buildRequest(AnalysisSession session, StrikeCandidate candidate) {
        String location = session.getFramesLocation();
        ClassificationRequest.FrameImages images = new ClassificationRequest.FrameImages(
            String.format(FRAME_IMAGE_PATTERN, location, candidate.window().before()),
            String.format(FRAME_IMAGE_PATTERN, location, candidate.window().during()),
            String.format(FRAME_IMAGE_PATTERN, location, candidate.window().after()));
        return new ClassificationRequest(
            session.getId(),
            session.getSportType(),
            candidate.thrower(),
            candidate.receiver(),
            candidate.limb(),
            candidate.timestampSeconds(),
            candidate.window(),
            images);
    }
}

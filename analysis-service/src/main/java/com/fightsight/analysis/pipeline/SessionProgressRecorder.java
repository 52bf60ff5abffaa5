package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.model.AnalysisSession;
import com.fightsight.analysis.repository.AnalysisSessionRepository;
import com.fightsight.analysis.repository.CombinationRepository;
import com.fightsight.analysis.repository.StrikeEventRepository;
import com.fightsight.common.detection.DetectionResult;
import com.fightsight.common.lifecycle.PipelineStage;
import com.fightsight.common.lifecycle.SessionStateMachine;
import com.fightsight.common.model.AnalysisStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * The only writer of a session's status, progress and totals. Every status change goes
 * through {@link SessionStateMachine}; every progress change goes through
 * {@link SessionStateMachine#advanceProgress}, so progress only rises and reaches 100
 * together with {@code COMPLETED}.
 */
@Component
public class SessionProgressRecorder {

    private static final Logger log = LoggerFactory.getLogger(SessionProgressRecorder.class);

    private static final int MAX_ERROR_MESSAGE_LENGTH = 2000;

    private final AnalysisSessionRepository sessionRepository;
    private final StrikeEventRepository strikeEventRepository;
    private final CombinationRepository combinationRepository;
    private final Clock clock;

    public SessionProgressRecorder(AnalysisSessionRepository sessionRepository,
                                   StrikeEventRepository strikeEventRepository,
                                   CombinationRepository combinationRepository,
                                   Clock clock) {
        this.sessionRepository     = sessionRepository;
        this.strikeEventRepository = strikeEventRepository;
        this.combinationRepository = combinationRepository;
        this.clock                 = clock;
    }

    /**
     * pending → processing. The status change is claimed in the database first, so only one
     * worker can start a session; losing the claim is an {@link IllegalStateException} and
     * leaves the row untouched.
     */
    public Mono<AnalysisSession> start(AnalysisSession session) {
        return Mono.fromCallable(() -> SessionStateMachine.transition(
                session.getId(), session.getStatus(), AnalysisStatus.PROCESSING))
            .flatMap(next -> {
                LocalDateTime startedAt = LocalDateTime.now(clock);
                return sessionRepository.claimForProcessing(session.getId(), startedAt)
                    .flatMap(rows -> {
                        if (rows == 0) {
                            log.warn("[Lifecycle] Session claimed by another worker. sessionId={}", session.getId());
                            return Mono.error(new IllegalStateException(
                                "Session " + session.getId() + " was already started by another worker"));
                        }
                        session.setStatus(next);
                        session.setStartedAt(startedAt);
                        session.setErrorMessage(null);
                        if (session.getProgressPercentage() == null) {
                            session.setProgressPercentage(0);
                        }
                        return sessionRepository.save(session);
                    });
            })
            .doOnSuccess(s -> log.info("[Lifecycle] Session started. sessionId={} status={}", s.getId(), s.getStatus()));
    }

    public Mono<AnalysisSession> detectionFinished(AnalysisSession session, DetectionResult detection) {
        session.setTotalFrames(detection.totalFrames());
        session.setSkippedFrames(detection.framesSkipped());
        session.setTotalCandidates(detection.candidates().size());
        advance(session, PipelineStage.DETECTION);
        return sessionRepository.save(session);
    }

    public Mono<AnalysisSession> classificationFinished(AnalysisSession session,
                                                        ClassificationTally tally,
                                                        PersistedStrikes strikes) {
        applyTally(session, tally);
        session.setTotalStrikes(strikes.size());
        advance(session, PipelineStage.CLASSIFICATION);
        return sessionRepository.save(session);
    }

    public Mono<AnalysisSession> enrichmentFinished(AnalysisSession session, CombinationAssignment assignment) {
        session.setTotalCombinations(assignment.combinations().size());
        advance(session, PipelineStage.ENRICHMENT);
        return sessionRepository.save(session);
    }

    /** processing → completed; totals are frozen from here on. */
    public Mono<AnalysisSession> complete(AnalysisSession session) {
        return Mono.fromCallable(() -> {
                session.setStatus(SessionStateMachine.transition(
                    session.getId(), session.getStatus(), AnalysisStatus.COMPLETED));
                LocalDateTime now = LocalDateTime.now(clock);
                session.setProgressPercentage(SessionStateMachine.COMPLETE_PERCENTAGE);
                session.setCompletedAt(now);
                session.setProcessingTimeMs(elapsedMs(session, now));
                return session;
            })
            .flatMap(sessionRepository::save)
            .doOnSuccess(s -> log.info("[Lifecycle] Session completed. sessionId={} strikes={} combinations={} "
                                       + "calls={} cost={} processingTimeMs={}",
                                       s.getId(), s.getTotalStrikes(), s.getTotalCombinations(),
                                       s.getClassificationCalls(), s.getTotalCost(), s.getProcessingTimeMs()));
    }

    /**
     * processing → failed. Derived rows written so far are removed; the classifier
     * calls and cost already spent stay on the session.
     */
    public Mono<AnalysisSession> fail(AnalysisSession session, Throwable error, ClassificationTally tally) {
        Long sessionId = session.getId();
        return Mono.fromCallable(() -> SessionStateMachine.transition(
                    sessionId, session.getStatus(), AnalysisStatus.FAILED))
            .flatMap(failed -> combinationRepository.deleteBySessionId(sessionId)
                .then(strikeEventRepository.deleteBySessionId(sessionId))
                .then(Mono.fromCallable(() -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    session.setStatus(failed);
                    session.setFailedAt(now);
                    session.setProcessingTimeMs(elapsedMs(session, now));
                    session.setErrorMessage(truncate(describe(error)));
                    session.setTotalStrikes(0);
                    session.setTotalCombinations(0);
                    if (tally != null) {
                        applyTally(session, tally);
                    }
                    return session;
                })))
            .flatMap(sessionRepository::save)
            .doOnSuccess(s -> log.error("[Lifecycle] Session failed. sessionId={} progress={} reason={}",
                                        sessionId, s.getProgressPercentage(), s.getErrorMessage()));
    }

    private void advance(AnalysisSession session, PipelineStage stage) {
        int current = session.getProgressPercentage() != null ? session.getProgressPercentage() : 0;
        session.setProgressPercentage(SessionStateMachine.advanceProgress(current, stage));
        log.info("[Lifecycle] Stage finished. sessionId={} stage={} progress={}",
                 session.getId(), stage, session.getProgressPercentage());
    }

    private static void applyTally(AnalysisSession session, ClassificationTally tally) {
        session.setClassificationCalls(tally.calls());
        session.setClassifiedCount(tally.classified());
        session.setFalsePositiveCount(tally.falsePositive());
        session.setFailedCount(tally.failed());
        session.setTotalCost(tally.cost());
    }

    private static Long elapsedMs(AnalysisSession session, LocalDateTime now) {
        return session.getStartedAt() != null ? Duration.between(session.getStartedAt(), now).toMillis() : null;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_MESSAGE_LENGTH ? message : message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}

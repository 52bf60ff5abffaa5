package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.client.PoseFrameSource;
import com.fightsight.analysis.config.PipelineSettings;
import com.fightsight.analysis.logger.PipelineFlowLogger;
import com.fightsight.analysis.model.AnalysisSession;
import com.fightsight.analysis.repository.AnalysisSessionRepository;
import com.fightsight.analysis.repository.SessionFighterRepository;
import com.fightsight.common.detection.DetectionResult;
import com.fightsight.common.detection.StrikeCandidateDetector;
import com.fightsight.common.exception.PipelineException;
import com.fightsight.common.exception.PipelineTimeoutException;
import com.fightsight.common.exception.ValidationException;
import com.fightsight.common.model.AnalysisStatus;
import com.fightsight.common.model.PoseFrame;
import com.fightsight.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Session lifecycle controller: drives one session from {@code PENDING} to a terminal
 * status, running the stages strictly in order.
 *
 * <pre>
 *   claim → start (PROCESSING)
 *         → fetch frames → detect                      (progress 20)
 *         → classify → store strike events             (progress 80)
 *         → combinations → enrichment + fighter totals (progress 99)
 *         → COMPLETED (100) → report handoff (non-fatal)
 *   any error after start → FAILED with error_message, derived rows removed
 * </pre>
 *
 * <p>Only classification runs concurrently, inside {@link ClassificationOrchestrator}.
 * The session is claimed in {@link SessionOwnershipRegistry} for the whole run, so no other
 * pipeline on this worker mutates it meanwhile.
 */
@Service
public class AnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final AnalysisSessionRepository sessionRepository;
    private final SessionFighterRepository fighterRepository;
    private final PoseFrameSource poseFrameSource;
    private final StrikeCandidateDetector detector;
    private final ClassificationOrchestrator classificationOrchestrator;
    private final StrikeEventWriter strikeEventWriter;
    private final CombinationService combinationService;
    private final EnrichmentService enrichmentService;
    private final ReportService reportService;
    private final SessionProgressRecorder recorder;
    private final SessionOwnershipRegistry ownership;
    private final PipelineFlowLogger flowLogger;
    private final PipelineSettings settings;
    private final Clock clock;

    public AnalysisPipeline(AnalysisSessionRepository sessionRepository,
                            SessionFighterRepository fighterRepository,
                            PoseFrameSource poseFrameSource,
                            StrikeCandidateDetector detector,
                            ClassificationOrchestrator classificationOrchestrator,
                            StrikeEventWriter strikeEventWriter,
                            CombinationService combinationService,
                            EnrichmentService enrichmentService,
                            ReportService reportService,
                            SessionProgressRecorder recorder,
                            SessionOwnershipRegistry ownership,
                            PipelineFlowLogger flowLogger,
                            PipelineSettings settings,
                            Clock clock) {
        this.sessionRepository          = sessionRepository;
        this.fighterRepository          = fighterRepository;
        this.poseFrameSource            = poseFrameSource;
        this.detector                   = detector;
        this.classificationOrchestrator = classificationOrchestrator;
        this.strikeEventWriter          = strikeEventWriter;
        this.combinationService         = combinationService;
        this.enrichmentService          = enrichmentService;
        this.reportService              = reportService;
        this.recorder                   = recorder;
        this.ownership                  = ownership;
        this.flowLogger                 = flowLogger;
        this.settings                   = settings;
        this.clock                      = clock;
    }

    /**
     * Runs the session to a terminal status.
     *
     * <p>Errors that happen before the session is started (unknown session, already owned,
     * not {@code PENDING}, no frames location) are returned as errors and leave the session
     * untouched. Anything that goes wrong afterwards ends as a {@code FAILED} session,
     * which is returned normally.
     *
     * @param framesLocationOverride replaces the stored frames location when not blank
     */
    public Mono<AnalysisSession> run(Long sessionId, String framesLocationOverride) {
        Mono<AnalysisSession> pipeline = Mono.defer(() -> {
            if (!ownership.claim(sessionId)) {
                return Mono.error(new IllegalStateException("Session " + sessionId + " is already being processed"));
            }
            return sessionRepository.findById(sessionId)
                .switchIfEmpty(Mono.error(() -> new NoSuchElementException("Analysis session not found: " + sessionId)))
                .flatMap(session -> prepare(session, framesLocationOverride))
                .flatMap(recorder::start)
                .doOnEach(flowLogger.stage(PipelineFlowLogger.RUN_ACCEPTED))
                .flatMap(this::process)
                .doFinally(signal -> ownership.release(sessionId));
        });
        return TraceContextUtil.withSessionId(pipeline, sessionId);
    }

    private Mono<AnalysisSession> prepare(AnalysisSession session, String framesLocationOverride) {
        if (framesLocationOverride != null && !framesLocationOverride.isBlank()) {
            session.setFramesLocation(framesLocationOverride);
        }
        if (session.getFramesLocation() == null || session.getFramesLocation().isBlank()) {
            return Mono.error(new ValidationException(session.getId(), "Session has no frames location"));
        }
        if (session.getStatus() != AnalysisStatus.PENDING) {
            log.warn("[Pipeline] Session is not pending. sessionId={} status={}", session.getId(), session.getStatus());
        }
        return Mono.just(session);
    }

    // ── stages ────────────────────────────────────────────────────────────────

    private Mono<AnalysisSession> process(AnalysisSession started) {
        RunState run = new RunState(started, SessionDeadline.startingAt(
            clock.instant(), settings.maxSessionDuration(), settings.drainGrace()));
        Long sessionId = started.getId();

        Mono<AnalysisSession> stages = fighterRepository.findBySessionId(sessionId)
            .collectList()
            .map(fighters -> SessionFighters.of(sessionId, fighters))
            .doOnNext(fighters -> run.fighters = fighters)
            .then(Mono.defer(() -> poseFrameSource.fetchFrames(sessionId, run.session.getFramesLocation())))
            .doOnEach(flowLogger.stage(PipelineFlowLogger.FRAMES_FETCHED))
            .flatMap(frames -> detect(run, frames))
            .flatMap(detection -> classify(run, detection))
            .flatMap(session -> combinationService.rebuild(sessionId, run.strikes, run.fighters))
            .doOnNext(assignment -> run.assignment = assignment)
            .doOnEach(flowLogger.stage(PipelineFlowLogger.COMBINATIONS_BUILT))
            .flatMap(assignment -> enrichmentService.enrich(
                sessionId, run.strikes, assignment, run.fighters, run.footageSeconds))
            .doOnNext(enrichment -> run.enrichment = enrichment)
            .doOnEach(flowLogger.stage(PipelineFlowLogger.STRIKES_ENRICHED))
            .flatMap(enrichment -> recorder.enrichmentFinished(run.session, run.assignment))
            .flatMap(recorder::complete)
            .doOnEach(flowLogger.stage(PipelineFlowLogger.SESSION_COMPLETED));

        return stages
            .timeout(run.deadline.budget().plus(run.deadline.drainGrace()),
                     Mono.error(() -> new PipelineTimeoutException(sessionId, run.deadline.budget())))
            .onErrorResume(error -> recordFailure(run, error))
            .flatMap(session -> session.getStatus() == AnalysisStatus.COMPLETED
                ? handOffReport(run, session)
                : Mono.just(session));
    }

    private Mono<DetectionResult> detect(RunState run, List<PoseFrame> frames) {
        run.footageSeconds = footageSeconds(frames);
        return Mono.fromCallable(() -> detector.detect(frames))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(detection -> recorder.detectionFinished(run.session, detection)
                .doOnNext(saved -> run.session = saved)
                .thenReturn(detection))
            .doOnEach(flowLogger.stage(PipelineFlowLogger.CANDIDATES_DETECTED));
    }

    private Mono<AnalysisSession> classify(RunState run, DetectionResult detection) {
        Long sessionId = run.session.getId();
        run.tally = new ClassificationTally(detection.candidates().size());
        return classificationOrchestrator.classifyAll(run.session, detection.candidates(), run.deadline, run.tally)
            .flatMap(report -> strikeEventWriter.write(sessionId, report, run.fighters))
            .doOnNext(strikes -> run.strikes = strikes)
            .flatMap(strikes -> recorder.classificationFinished(run.session, run.tally, strikes))
            .doOnNext(saved -> run.session = saved)
            .doOnEach(flowLogger.stage(PipelineFlowLogger.STRIKES_CLASSIFIED));
    }

    private Mono<AnalysisSession> recordFailure(RunState run, Throwable error) {
        boolean fatal = !(error instanceof PipelineException) || ((PipelineException) error).isFatal();
        log.error("[Pipeline] Run aborted. sessionId={} fatal={} errorType={} reason={}",
                  run.session.getId(), fatal, error.getClass().getSimpleName(), error.getMessage());
        return recorder.fail(run.session, error, run.tally);
    }

    private Mono<AnalysisSession> handOffReport(RunState run, AnalysisSession completed) {
        return reportService.generate(completed, run.strikes, run.enrichment, run.assignment)
            .doOnEach(flowLogger.stage(PipelineFlowLogger.REPORT_STORED))
            .onErrorResume(e -> {
                log.warn("[Pipeline] Report generation failed (non-fatal). sessionId={} reason={}",
                         completed.getId(), e.getMessage());
                return Mono.empty();
            })
            .thenReturn(completed);
    }

    /** Span between the first and last well-formed frame timestamps. */
    static double footageSeconds(List<PoseFrame> frames) {
        double first = Double.NaN;
        double last  = Double.NaN;
        for (PoseFrame frame : frames) {
            if (frame == null || !Double.isFinite(frame.timestampSeconds()) || frame.timestampSeconds() < 0.0) {
                continue;
            }
            if (Double.isNaN(first)) {
                first = frame.timestampSeconds();
            }
            if (Double.isNaN(last) || frame.timestampSeconds() > last) {
                last = frame.timestampSeconds();
            }
        }
        return Double.isNaN(first) ? 0.0 : Math.max(0.0, last - first);
    }

    /** Mutable per-run context threaded through the stage chain; touched by one stage at a time. */
    private static final class RunState {
        private volatile AnalysisSession session;
        private final SessionDeadline deadline;
        private volatile SessionFighters fighters;
        private volatile ClassificationTally tally;
        private volatile PersistedStrikes strikes;
        private volatile CombinationAssignment assignment;
        private volatile EnrichmentResult enrichment;
        private volatile double footageSeconds;

        private RunState(AnalysisSession session, SessionDeadline deadline) {
            this.session  = session;
            this.deadline = deadline;
        }
    }
}

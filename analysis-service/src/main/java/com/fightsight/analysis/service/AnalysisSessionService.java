package com.fightsight.analysis.service;

import com.fightsight.analysis.dto.CombinationDTO;
import com.fightsight.analysis.dto.CreateSessionRequest;
import com.fightsight.analysis.dto.FighterTotalsDTO;
import com.fightsight.analysis.dto.ReportDTO;
import com.fightsight.analysis.dto.SessionStatusDTO;
import com.fightsight.analysis.job.AnalysisJob;
import com.fightsight.analysis.job.AnalysisJobDispatcher;
import com.fightsight.analysis.model.AnalysisReport;
import com.fightsight.analysis.model.AnalysisSession;
import com.fightsight.analysis.model.Combination;
import com.fightsight.analysis.model.CombinationStrike;
import com.fightsight.analysis.model.SessionFighter;
import com.fightsight.analysis.model.StrikeEvent;
import com.fightsight.analysis.repository.AnalysisReportRepository;
import com.fightsight.analysis.repository.AnalysisSessionRepository;
import com.fightsight.analysis.repository.CombinationRepository;
import com.fightsight.analysis.repository.CombinationStrikeRepository;
import com.fightsight.analysis.repository.SessionFighterRepository;
import com.fightsight.analysis.repository.StrikeEventRepository;
import com.fightsight.common.exception.IllegalSessionTransitionException;
import com.fightsight.common.exception.ValidationException;
import com.fightsight.common.model.AnalysisStatus;
import com.fightsight.common.model.FighterLabel;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Job intake and read side: creates sessions with their two fighters, queues runs
 * and exposes what the pipeline stored.
 */
@Service
public class AnalysisSessionService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSessionService.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final AnalysisSessionRepository sessionRepository;
    private final SessionFighterRepository fighterRepository;
    private final StrikeEventRepository strikeEventRepository;
    private final CombinationRepository combinationRepository;
    private final CombinationStrikeRepository combinationStrikeRepository;
    private final AnalysisReportRepository reportRepository;
    private final AnalysisJobDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AnalysisSessionService(AnalysisSessionRepository sessionRepository,
                                  SessionFighterRepository fighterRepository,
                                  StrikeEventRepository strikeEventRepository,
                                  CombinationRepository combinationRepository,
                                  CombinationStrikeRepository combinationStrikeRepository,
                                  AnalysisReportRepository reportRepository,
                                  AnalysisJobDispatcher dispatcher,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.sessionRepository           = sessionRepository;
        this.fighterRepository           = fighterRepository;
        this.strikeEventRepository       = strikeEventRepository;
        this.combinationRepository       = combinationRepository;
        this.combinationStrikeRepository = combinationStrikeRepository;
        this.reportRepository            = reportRepository;
        this.dispatcher                  = dispatcher;
        this.objectMapper                = objectMapper;
        this.clock                       = clock;
    }

    // ── intake ─────────────────────────────────────────────────────────────

    public Mono<SessionStatusDTO> createSession(CreateSessionRequest request) {
        return Mono.fromRunnable(() -> validate(request))
            .then(Mono.fromCallable(() -> newSession(request)))
            .flatMap(sessionRepository::save)
            .flatMap(session -> Flux.concat(
                    fighterRepository.save(newFighter(session.getId(), FighterLabel.FIGHTER_A, request.fighterA())),
                    fighterRepository.save(newFighter(session.getId(), FighterLabel.FIGHTER_B, request.fighterB())))
                .map(FighterTotalsDTO::from)
                .collectList()
                .map(fighters -> SessionStatusDTO.from(session, fighters)))
            .doOnSuccess(dto -> log.info("[Intake] Session created. sessionId={} videoId={} sport={}",
                                         dto.id(), dto.videoId(), dto.sportType()))
            .doOnError(e -> log.warn("[Intake] Session rejected. videoId={} reason={}",
                                     request == null ? null : request.videoId(), e.getMessage()));
    }

    /**
     * Queues a run for a pending session. Emits {@code false} when the worker queue
     * refuses the job.
     */
    public Mono<Boolean> requestRun(Long sessionId, String framesLocation) {
        return findSession(sessionId)
            .flatMap(session -> {
                if (session.getStatus() != AnalysisStatus.PENDING || dispatcher.isRunning(sessionId)) {
                    return Mono.error(new IllegalSessionTransitionException(
                        sessionId, session.getStatus(), AnalysisStatus.PROCESSING));
                }
                return Mono.just(dispatcher.submit(new AnalysisJob(sessionId, framesLocation)));
            });
    }

    /** Deletes the session; fighters, strikes, combinations and the report go with it. */
    public Mono<Void> deleteSession(Long sessionId) {
        if (dispatcher.isRunning(sessionId)) {
            return Mono.error(new IllegalStateException("Session " + sessionId + " is being processed"));
        }
        return findSession(sessionId)
            .flatMap(session -> sessionRepository.deleteById(session.getId()))
            .doOnSuccess(v -> log.info("[Intake] Session deleted. sessionId={}", sessionId));
    }

    // ── read side ──────────────────────────────────────────────────────────

    public Mono<SessionStatusDTO> getSession(Long sessionId) {
        return findSession(sessionId)
            .flatMap(session -> fighterRepository.findBySessionId(sessionId)
                .sort(Comparator.comparing(SessionFighter::getLabel))
                .map(FighterTotalsDTO::from)
                .collectList()
                .map(fighters -> SessionStatusDTO.from(session, fighters)));
    }

    public Flux<StrikeEvent> getStrikes(Long sessionId) {
        return strikeEventRepository.findBySessionIdOrderByTimestampSecondsAsc(sessionId);
    }

    public Flux<CombinationDTO> getCombinations(Long sessionId) {
        Mono<Map<Long, Collection<CombinationStrike>>> linksByCombination =
            combinationStrikeRepository.findBySessionId(sessionId)
                .collectMultimap(CombinationStrike::getCombinationId);
        return linksByCombination.flatMapMany(links ->
            combinationRepository.findBySessionIdOrderByStartTimestampAsc(sessionId)
                .map(c -> toDto(c, links.getOrDefault(c.getId(), List.of()))));
    }

    public Mono<ReportDTO> getReport(Long sessionId) {
        return reportRepository.findBySessionId(sessionId)
            .flatMap(report -> Mono.fromCallable(() -> toDto(report)));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private Mono<AnalysisSession> findSession(Long sessionId) {
        return sessionRepository.findById(sessionId)
            .switchIfEmpty(Mono.error(() -> new NoSuchElementException("Analysis session not found: " + sessionId)));
    }

    static void validate(CreateSessionRequest request) {
        if (request == null) {
            throw new ValidationException(null, "Request body is required");
        }
        if (isBlank(request.videoId())) {
            throw new ValidationException(null, "videoId is required");
        }
        if (isBlank(request.framesLocation())) {
            throw new ValidationException(null, "framesLocation is required");
        }
        if (request.sportType() == null) {
            throw new ValidationException(null, "sportType is required");
        }
        if (request.roundCount() != null && request.roundCount() < 1) {
            throw new ValidationException(null, "roundCount must be at least 1");
        }
        validateFighter("fighterA", request.fighterA());
        validateFighter("fighterB", request.fighterB());
    }

    private static void validateFighter(String field, CreateSessionRequest.FighterSpec spec) {
        if (spec == null || isBlank(spec.displayName())) {
            throw new ValidationException(null, field + ".displayName is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private AnalysisSession newSession(CreateSessionRequest request) {
        AnalysisSession session = new AnalysisSession();
        session.setVideoId(request.videoId());
        session.setFramesLocation(request.framesLocation());
        session.setSportType(request.sportType());
        session.setRoundCount(request.roundCount());
        session.setStatus(AnalysisStatus.PENDING);
        session.setProgressPercentage(0);
        session.setTotalCost(0.0);
        session.setClassificationCalls(0);
        session.setTotalCandidates(0);
        session.setClassifiedCount(0);
        session.setFalsePositiveCount(0);
        session.setFailedCount(0);
        session.setTotalFrames(0);
        session.setSkippedFrames(0);
        session.setTotalStrikes(0);
        session.setTotalCombinations(0);
        session.setCreatedAt(LocalDateTime.now(clock));
        return session;
    }

    private static SessionFighter newFighter(Long sessionId, FighterLabel label, CreateSessionRequest.FighterSpec spec) {
        SessionFighter fighter = new SessionFighter();
        fighter.setSessionId(sessionId);
        fighter.setLabel(label);
        fighter.setDisplayName(spec.displayName().trim());
        fighter.setStance(spec.stance());
        fighter.setFighterProfileId(spec.fighterProfileId());
        fighter.setStrikesThrown(0);
        fighter.setStrikesLanded(0);
        fighter.setStrikesReceived(0);
        fighter.setCombinationsThrown(0);
        return fighter;
    }

    private static CombinationDTO toDto(Combination c, Collection<CombinationStrike> links) {
        List<Long> strikeIds = links.stream()
            .sorted(Comparator.comparing(CombinationStrike::getPositionInSequence))
            .map(CombinationStrike::getStrikeEventId)
            .toList();
        return new CombinationDTO(c.getId(), c.getThrowerId(), c.getStartTimestamp(), c.getEndTimestamp(),
            c.getDurationSeconds(), c.getStrikeCount(), c.getLandedCount(), c.getMissedCount(), strikeIds);
    }

    private ReportDTO toDto(AnalysisReport report) throws Exception {
        return new ReportDTO(report.getSessionId(), report.getNarrative(),
            readList(report.getKeyInsights()), readList(report.getStrengths()),
            readList(report.getAreasForImprovement()), report.getGenerationCost(), report.getCreatedAt());
    }

    private List<String> readList(String json) throws Exception {
        return json == null || json.isBlank() ? List.of() : objectMapper.readValue(json, STRING_LIST);
    }
}

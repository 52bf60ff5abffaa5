package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.client.dto.ClassificationResponse;
import com.fightsight.analysis.model.StrikeEvent;
import com.fightsight.analysis.repository.StrikeEventRepository;
import com.fightsight.common.model.StrikeCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes confirmed classifications as strike events, one at a time and in outcome
 * order, so row ids ascend with match time.
 */
@Component
public class StrikeEventWriter {

    private static final Logger log = LoggerFactory.getLogger(StrikeEventWriter.class);

    private final StrikeEventRepository strikeEventRepository;
    private final Clock clock;

    public StrikeEventWriter(StrikeEventRepository strikeEventRepository, Clock clock) {
        this.strikeEventRepository = strikeEventRepository;
        this.clock                 = clock;
    }

    /**
     * Replaces the session's strike events with the confirmed outcomes of {@code report}.
     */
    public Mono<PersistedStrikes> write(Long sessionId, ClassificationReport report, SessionFighters fighters) {
        List<ClassificationOutcome> confirmed = report.confirmed();
        LocalDateTime now = LocalDateTime.now(clock);

        return strikeEventRepository.deleteBySessionId(sessionId)
            .thenMany(Flux.fromIterable(confirmed)
                .map(outcome -> toEntity(sessionId, outcome, fighters, now))
                .concatMap(strikeEventRepository::save))
            .collectList()
            .map(events -> PersistedStrikes.of(sessionId, events, fighters))
            .doOnSuccess(strikes -> log.info("[StrikeEvents] Persisted. sessionId={} strikes={}",
                                             sessionId, strikes.size()));
    }

    static StrikeEvent toEntity(Long sessionId, ClassificationOutcome outcome,
                                SessionFighters fighters, LocalDateTime createdAt) {
        StrikeCandidate candidate = outcome.candidate();
        ClassificationResponse response = outcome.response();

        StrikeEvent event = new StrikeEvent();
        event.setSessionId(sessionId);
        event.setThrowerId(fighters.idOf(candidate.thrower()));
        event.setReceiverId(fighters.idOf(candidate.receiver()));
        event.setTimestampSeconds(candidate.timestampSeconds());
        event.setFrameNumber(candidate.frameIndex());
        event.setLimb(candidate.limb());
        event.setVelocity(candidate.velocity());
        event.setFighterDistance(candidate.fighterDistance());
        event.setDetectionConfidence(candidate.confidence());
        event.setStance(response.stance());
        event.setCategory(response.category());
        event.setTechnique(response.technique());
        event.setModifier(response.modifier());
        event.setTargetZone(response.targetZone());
        event.setOutcome(response.outcome());
        event.setClassificationConfidence(response.confidence());
        event.setReasoning(response.reasoning());
        event.setClassificationCost(response.cost());
        event.setInCombination(false);
        event.setCreatedAt(createdAt);
        return event;
    }
}

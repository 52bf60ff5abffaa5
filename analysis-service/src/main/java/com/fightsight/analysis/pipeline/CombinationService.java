package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.config.PipelineSettings;
import com.fightsight.analysis.model.Combination;
import com.fightsight.analysis.model.CombinationStrike;
import com.fightsight.analysis.repository.CombinationRepository;
import com.fightsight.analysis.repository.CombinationStrikeRepository;
import com.fightsight.common.combination.CombinationDetector;
import com.fightsight.common.combination.StrikeCluster;
import com.fightsight.common.exception.IntegrityViolationException;
import com.fightsight.common.model.StrikeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups a session's strikes into combinations and stores them with their ordered
 * membership links.
 *
 * <p>Any earlier combinations of the session are deleted first, so running the stage
 * twice over the same strikes leaves the same rows behind. The written links are checked
 * before the stage completes; a breach raises {@link IntegrityViolationException}.
 */
@Service
public class CombinationService {

    private static final Logger log = LoggerFactory.getLogger(CombinationService.class);

    private final CombinationRepository combinationRepository;
    private final CombinationStrikeRepository combinationStrikeRepository;
    private final double windowSeconds;

    public CombinationService(CombinationRepository combinationRepository,
                              CombinationStrikeRepository combinationStrikeRepository,
                              PipelineSettings pipelineSettings) {
        this.combinationRepository       = combinationRepository;
        this.combinationStrikeRepository = combinationStrikeRepository;
        this.windowSeconds               = pipelineSettings.combinationWindowSeconds();
    }

    public Mono<CombinationAssignment> rebuild(Long sessionId, PersistedStrikes strikes, SessionFighters fighters) {
        List<StrikeCluster> clusters = CombinationDetector.detect(strikes.records(), windowSeconds);
        List<CombinationStrike> writtenLinks = new ArrayList<>();

        return combinationRepository.deleteBySessionId(sessionId)
            .thenMany(Flux.fromIterable(clusters)
                .concatMap(cluster -> saveCluster(sessionId, cluster, strikes, fighters, writtenLinks)))
            .collectList()
            .map(combinations -> {
                verifyLinks(sessionId, combinations, writtenLinks);
                return new CombinationAssignment(clusters, combinations);
            })
            .doOnSuccess(a -> log.info("[Combinations] Rebuilt. sessionId={} strikes={} combinations={} windowSeconds={}",
                                       sessionId, strikes.size(), a.combinations().size(), windowSeconds));
    }

    private Mono<Combination> saveCluster(Long sessionId, StrikeCluster cluster, PersistedStrikes strikes,
                                          SessionFighters fighters, List<CombinationStrike> writtenLinks) {
        Combination combination = new Combination();
        combination.setSessionId(sessionId);
        combination.setThrowerId(fighters.idOf(cluster.thrower()));
        combination.setStartTimestamp(cluster.startTimestamp());
        combination.setEndTimestamp(cluster.endTimestamp());
        combination.setDurationSeconds(cluster.durationSeconds());
        combination.setStrikeCount(cluster.strikeCount());
        combination.setLandedCount(cluster.landedCount());
        combination.setMissedCount(cluster.missedCount());

        return combinationRepository.save(combination)
            .flatMap(saved -> {
                List<CombinationStrike> links = new ArrayList<>(cluster.strikeCount());
                List<StrikeRecord> members = cluster.members();
                for (int i = 0; i < members.size(); i++) {
                    StrikeRecord member = members.get(i);
                    if (member.thrower() != cluster.thrower()) {
                        return Mono.error(new IntegrityViolationException(sessionId,
                            "Strike " + member.id() + " thrown by " + member.thrower()
                                + " placed in a combination of " + cluster.thrower()));
                    }
                    CombinationStrike link = new CombinationStrike();
                    link.setCombinationId(saved.getId());
                    link.setStrikeEventId(strikes.eventOf(member).getId());
                    link.setPositionInSequence(i + 1);
                    links.add(link);
                }
                return combinationStrikeRepository.saveAll(links)
                    .doOnNext(writtenLinks::add)
                    .then(Mono.just(saved));
            });
    }

    /**
     * Positions of every combination run 1..strikeCount without gaps, and no strike
     * event is linked twice.
     */
    static void verifyLinks(Long sessionId, List<Combination> combinations, List<CombinationStrike> links) {
        Map<Long, Set<Integer>> positions = new HashMap<>();
        Set<Long> strikeIds = new HashSet<>();
        for (CombinationStrike link : links) {
            if (!strikeIds.add(link.getStrikeEventId())) {
                throw new IntegrityViolationException(sessionId,
                    "Strike " + link.getStrikeEventId() + " belongs to more than one combination");
            }
            positions.computeIfAbsent(link.getCombinationId(), k -> new HashSet<>())
                     .add(link.getPositionInSequence());
        }
        for (Combination combination : combinations) {
            Set<Integer> used = positions.getOrDefault(combination.getId(), Set.of());
            int count = combination.getStrikeCount();
            boolean gapless = used.size() == count;
            for (int p = 1; gapless && p <= count; p++) {
                gapless = used.contains(p);
            }
            if (!gapless) {
                throw new IntegrityViolationException(sessionId,
                    "Combination " + combination.getId() + " positions " + used + " are not 1.." + count);
            }
        }
    }
}

package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.config.PipelineSettings;
import com.fightsight.analysis.model.SessionFighter;
import com.fightsight.analysis.model.StrikeEvent;
import com.fightsight.analysis.repository.SessionFighterRepository;
import com.fightsight.analysis.repository.StrikeEventRepository;
import com.fightsight.common.enrichment.StrikeContext;
import com.fightsight.common.enrichment.StrikeContextEnricher;
import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.stats.FighterStats;
import com.fightsight.common.stats.SessionStatisticsAggregator;
import com.fightsight.common.stats.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Writes the enrichment fields and combination linkage onto stored strike events,
 * then the per-fighter aggregates. Everything is computed up front by the pure
 * {@link StrikeContextEnricher} and {@link SessionStatisticsAggregator}; this class only persists.
 */
@Service
public class EnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final StrikeEventRepository strikeEventRepository;
    private final SessionFighterRepository fighterRepository;
    private final double counterWindowSeconds;

    public EnrichmentService(StrikeEventRepository strikeEventRepository,
                             SessionFighterRepository fighterRepository,
                             PipelineSettings pipelineSettings) {
        this.strikeEventRepository = strikeEventRepository;
        this.fighterRepository     = fighterRepository;
        this.counterWindowSeconds  = pipelineSettings.counterWindowSeconds();
    }

    public Mono<EnrichmentResult> enrich(Long sessionId,
                                         PersistedStrikes strikes,
                                         CombinationAssignment assignment,
                                         SessionFighters fighters,
                                         double durationSeconds) {
        List<StrikeContext> contexts = StrikeContextEnricher.enrich(
            strikes.records(), assignment.clusters(), counterWindowSeconds);
        SessionSummary summary = SessionStatisticsAggregator.aggregate(
            contexts, assignment.clusters(), durationSeconds);

        return Flux.fromIterable(contexts)
            .map(context -> apply(strikes.eventOf(context.strike()), context, assignment))
            .concatMap(strikeEventRepository::save)
            .thenMany(Flux.fromIterable(fighters.all())
                .map(fighter -> applyTotals(fighter, summary.fighters().get(fighter.getLabel())))
                .concatMap(fighterRepository::save))
            .then(Mono.fromSupplier(() -> new EnrichmentResult(contexts, summary)))
            .doOnSuccess(r -> log.info("[Enrichment] Complete. sessionId={} strikes={} combinations={} "
                                       + "thrownA={} thrownB={}",
                                       sessionId, summary.totalStrikes(), summary.totalCombinations(),
                                       thrown(summary, FighterLabel.FIGHTER_A),
                                       thrown(summary, FighterLabel.FIGHTER_B)));
    }

    static StrikeEvent apply(StrikeEvent event, StrikeContext context, CombinationAssignment assignment) {
        event.setSequenceNumber(context.sequenceNumber());
        event.setSecondsSincePrevious(context.secondsSincePrevious());
        event.setRangeBucket(context.rangeBucket());
        event.setInitiation(context.initiation());
        event.setInCombination(context.inCombination());
        event.setCombinationId(context.inCombination() ? assignment.combinationIdOf(context.clusterIndex()) : null);
        event.setPositionInCombination(context.positionInCombination());
        return event;
    }

    static SessionFighter applyTotals(SessionFighter fighter, FighterStats stats) {
        fighter.setStrikesThrown(stats.strikesThrown());
        fighter.setStrikesLanded(stats.strikesLanded());
        fighter.setStrikesReceived(stats.strikesReceived());
        fighter.setCombinationsThrown(stats.combinationsThrown());
        return fighter;
    }

    private static int thrown(SessionSummary summary, FighterLabel label) {
        return summary.fighters().get(label).strikesThrown();
    }
}

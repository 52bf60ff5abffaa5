package com.fightsight.common.stats;

import com.fightsight.common.combination.StrikeCluster;
import com.fightsight.common.enrichment.StrikeContext;
import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.InitiationType;
import com.fightsight.common.model.StrikeCategory;
import com.fightsight.common.model.StrikeRecord;
import com.fightsight.common.model.TargetZone;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless reduction of enriched strikes and clusters into a {@link SessionSummary}.
 * Both fighters always appear in the summary, with zero counts when they threw nothing.
 */
public final class SessionStatisticsAggregator {

    private SessionStatisticsAggregator() {}

    public static SessionSummary aggregate(List<StrikeContext> contexts,
                                           List<StrikeCluster> clusters,
                                           double durationSeconds) {
        List<StrikeContext> strikes = contexts != null ? contexts : List.of();
        List<StrikeCluster> combos  = clusters != null ? clusters : List.of();

        Map<FighterLabel, FighterStats> fighters = new EnumMap<>(FighterLabel.class);
        for (FighterLabel label : FighterLabel.values()) {
            fighters.put(label, fighterStats(label, strikes, combos));
        }

        double perMinute = durationSeconds > 0.0 ? strikes.size() / (durationSeconds / 60.0) : 0.0;
        double averageLength = combos.isEmpty()
            ? 0.0
            : combos.stream().mapToInt(StrikeCluster::strikeCount).average().orElse(0.0);

        return new SessionSummary(strikes.size(), combos.size(), durationSeconds,
            perMinute, averageLength, fighters);
    }

    static FighterStats fighterStats(FighterLabel label, List<StrikeContext> strikes, List<StrikeCluster> clusters) {
        int thrown = 0;
        int landed = 0;
        int received = 0;
        int absorbed = 0;
        int counters = 0;
        Map<StrikeCategory, Integer> byCategory = new EnumMap<>(StrikeCategory.class);
        Map<TargetZone, Integer> byTarget = new EnumMap<>(TargetZone.class);

        for (StrikeContext context : strikes) {
            StrikeRecord strike = context.strike();
            if (strike.thrower() == label) {
                thrown++;
                if (strike.landed()) landed++;
                if (context.initiation() == InitiationType.COUNTER) counters++;
                if (strike.category() != null) byCategory.merge(strike.category(), 1, Integer::sum);
                if (strike.targetZone() != null) byTarget.merge(strike.targetZone(), 1, Integer::sum);
            } else {
                received++;
                if (strike.landed()) absorbed++;
            }
        }
        int combinations = (int) clusters.stream().filter(c -> c.thrower() == label).count();
        double accuracy = thrown > 0 ? (double) landed / thrown : 0.0;

        return new FighterStats(label, thrown, landed, received, absorbed, combinations,
            counters, accuracy, byCategory, byTarget);
    }
}

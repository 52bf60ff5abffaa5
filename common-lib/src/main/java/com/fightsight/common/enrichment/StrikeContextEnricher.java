package com.fightsight.common.enrichment;

import com.fightsight.common.combination.StrikeCluster;
import com.fightsight.common.combination.StrikeOrdering;
import com.fightsight.common.model.InitiationType;
import com.fightsight.common.model.RangeBucket;
import com.fightsight.common.model.StrikeRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure enrichment pass over a session's classified strikes. No external calls; the output
 * depends only on the strike set and the clusters computed from it.
 *
 * <h3>Range bucket</h3>
 * <pre>
 *   fighterDistance &lt; 0.25 → CLOSE
 *   fighterDistance &lt; 0.45 → MID
 *   otherwise              → LONG
 *   unknown distance       → by category: KNEE/ELBOW → CLOSE, HAND → MID, KICK → LONG
 * </pre>
 *
 * <h3>Initiation</h3>
 * Looks for the receiver's most recent strike at most {@code counterWindowSeconds} earlier:
 * <ul>
 *   <li>none → {@link InitiationType#OFFENSE}</li>
 *   <li>it landed → {@link InitiationType#DEFENSIVE_RESPONSE} (firing back after being hit)</li>
 *   <li>it was defended or missed → {@link InitiationType#COUNTER}</li>
 * </ul>
 */
public final class StrikeContextEnricher {

    public static final double DEFAULT_COUNTER_WINDOW_SECONDS = 1.0;

    static final double CLOSE_RANGE_MAX = 0.25;
    static final double MID_RANGE_MAX   = 0.45;

    private StrikeContextEnricher() {}

    /**
     * @param strikes  the session's strikes, any order
     * @param clusters clusters built from the same {@code strikes} instances
     * @return one context per strike, in canonical order
     */
    public static List<StrikeContext> enrich(List<StrikeRecord> strikes,
                                             List<StrikeCluster> clusters,
                                             double counterWindowSeconds) {
        List<StrikeContext> contexts = new ArrayList<>();
        if (strikes == null || strikes.isEmpty()) {
            return contexts;
        }

        Map<StrikeRecord, int[]> membership = new HashMap<>();
        if (clusters != null) {
            for (int c = 0; c < clusters.size(); c++) {
                List<StrikeRecord> members = clusters.get(c).members();
                for (int p = 0; p < members.size(); p++) {
                    membership.put(members.get(p), new int[] {c, p + 1});
                }
            }
        }

        List<StrikeRecord> ordered = new ArrayList<>(strikes);
        ordered.sort(StrikeOrdering.CANONICAL);

        for (int i = 0; i < ordered.size(); i++) {
            StrikeRecord strike = ordered.get(i);
            Double sincePrevious = i == 0
                ? null
                : strike.timestampSeconds() - ordered.get(i - 1).timestampSeconds();
            int[] slot = membership.get(strike);
            contexts.add(new StrikeContext(
                strike,
                i + 1,
                sincePrevious,
                rangeBucket(strike),
                initiation(ordered, i, counterWindowSeconds),
                slot != null ? slot[0] : null,
                slot != null ? slot[1] : null));
        }
        return contexts;
    }

    static RangeBucket rangeBucket(StrikeRecord strike) {
        Double distance = strike.fighterDistance();
        if (distance != null) {
            if (distance < CLOSE_RANGE_MAX) return RangeBucket.CLOSE;
            if (distance < MID_RANGE_MAX)   return RangeBucket.MID;
            return RangeBucket.LONG;
        }
        if (strike.category() == null) {
            return RangeBucket.MID;
        }
        return switch (strike.category()) {
            case KNEE, ELBOW -> RangeBucket.CLOSE;
            case HAND        -> RangeBucket.MID;
            case KICK        -> RangeBucket.LONG;
        };
    }

    static InitiationType initiation(List<StrikeRecord> ordered, int index, double counterWindowSeconds) {
        StrikeRecord strike = ordered.get(index);
        for (int j = index - 1; j >= 0; j--) {
            StrikeRecord earlier = ordered.get(j);
            if (strike.timestampSeconds() - earlier.timestampSeconds() > counterWindowSeconds) {
                break;
            }
            if (earlier.thrower() == strike.receiver()) {
                return earlier.landed() ? InitiationType.DEFENSIVE_RESPONSE : InitiationType.COUNTER;
            }
        }
        return InitiationType.OFFENSE;
    }
}

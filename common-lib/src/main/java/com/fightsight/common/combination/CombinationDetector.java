package com.fightsight.common.combination;

import com.fightsight.common.model.StrikeRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy single-pass clustering of a session's strikes into combinations.
 *
 * <p>Strikes are visited in {@link StrikeOrdering#CANONICAL} order while one cluster is open.
 * A strike joins the open cluster when it has the cluster's thrower and its gap to the
 * cluster's most recent strike is at most {@code windowSeconds}. Otherwise the open cluster
 * closes (kept only with ≥ {@value #MIN_STRIKES} strikes) and the strike opens a new one.
 * The trailing cluster is flushed with the same rule.
 *
 * <p>The result depends only on the input set, never on its order, so re-running on the
 * same strikes yields the same clusters and positions.
 */
public final class CombinationDetector {

    public static final double DEFAULT_WINDOW_SECONDS = 2.0;
    public static final int    MIN_STRIKES            = 2;

    private CombinationDetector() {}

    public static List<StrikeCluster> detect(List<StrikeRecord> strikes, double windowSeconds) {
        if (!(windowSeconds > 0.0)) {
            throw new IllegalArgumentException("windowSeconds must be positive: " + windowSeconds);
        }
        List<StrikeCluster> clusters = new ArrayList<>();
        if (strikes == null || strikes.isEmpty()) {
            return clusters;
        }

        List<StrikeRecord> ordered = new ArrayList<>(strikes);
        ordered.sort(StrikeOrdering.CANONICAL);

        List<StrikeRecord> open = new ArrayList<>();
        for (StrikeRecord strike : ordered) {
            if (!open.isEmpty()) {
                StrikeRecord latest = open.get(open.size() - 1);
                boolean sameThrower = latest.thrower() == strike.thrower();
                boolean withinWindow = strike.timestampSeconds() - latest.timestampSeconds() <= windowSeconds;
                if (sameThrower && withinWindow) {
                    open.add(strike);
                    continue;
                }
                flush(open, clusters);
            }
            open.add(strike);
        }
        flush(open, clusters);
        return clusters;
    }

    private static void flush(List<StrikeRecord> open, List<StrikeCluster> clusters) {
        if (open.size() >= MIN_STRIKES) {
            clusters.add(new StrikeCluster(open.get(0).thrower(), open));
        }
        open.clear();
    }
}

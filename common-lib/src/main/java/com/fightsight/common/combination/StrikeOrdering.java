package com.fightsight.common.combination;

import com.fightsight.common.model.StrikeCandidate;
import com.fightsight.common.model.StrikeRecord;

import java.util.Comparator;

/**
 * Canonical, total ordering of strikes within a session.
 *
 * <pre>
 *   timestamp → frame number → thrower label (fighter_a first) → limb → id (nulls last)
 * </pre>
 * Equal-timestamp strikes therefore always resolve the same way, which keeps clustering
 * and position assignment deterministic.
 */
public final class StrikeOrdering {

    public static final Comparator<StrikeRecord> CANONICAL = Comparator
        .comparingDouble(StrikeRecord::timestampSeconds)
        .thenComparingInt(StrikeRecord::frameNumber)
        .thenComparing(StrikeRecord::thrower)
        .thenComparing(StrikeRecord::limb, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(StrikeRecord::id, Comparator.nullsLast(Comparator.naturalOrder()));

    public static final Comparator<StrikeCandidate> CANDIDATES = Comparator
        .comparingDouble(StrikeCandidate::timestampSeconds)
        .thenComparingInt(StrikeCandidate::frameIndex)
        .thenComparing(StrikeCandidate::thrower)
        .thenComparing(StrikeCandidate::limb);

    private StrikeOrdering() {}
}

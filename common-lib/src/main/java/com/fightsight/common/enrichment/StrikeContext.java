package com.fightsight.common.enrichment;

import com.fightsight.common.model.InitiationType;
import com.fightsight.common.model.RangeBucket;
import com.fightsight.common.model.StrikeRecord;

/**
 * Derived, order-dependent annotations of one strike.
 *
 * @param sequenceNumber         1-based ordinal of the strike in its session
 * @param secondsSincePrevious   gap to the previous strike by either fighter; {@code null} for the first
 * @param clusterIndex           index into the cluster list the context was built from, or {@code null}
 * @param positionInCombination  1-based position inside the cluster, or {@code null}
 */
public record StrikeContext(
    StrikeRecord strike,
    int sequenceNumber,
    Double secondsSincePrevious,
    RangeBucket rangeBucket,
    InitiationType initiation,
    Integer clusterIndex,
    Integer positionInCombination
) {
    public boolean inCombination() {
        return clusterIndex != null;
    }
}

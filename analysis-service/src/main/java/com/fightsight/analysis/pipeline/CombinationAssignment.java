package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.model.Combination;
import com.fightsight.common.combination.StrikeCluster;

import java.util.List;

/**
 * Clusters of a session and their stored rows; {@code combinations.get(i)} holds {@code clusters.get(i)}.
 */
public record CombinationAssignment(List<StrikeCluster> clusters, List<Combination> combinations) {

    public CombinationAssignment {
        clusters     = List.copyOf(clusters);
        combinations = List.copyOf(combinations);
        if (clusters.size() != combinations.size()) {
            throw new IllegalArgumentException("clusters and combinations must align: "
                + clusters.size() + " vs " + combinations.size());
        }
    }

    public Long combinationIdOf(int clusterIndex) {
        return combinations.get(clusterIndex).getId();
    }
}

package com.fightsight.analysis.pipeline;

import com.fightsight.common.enrichment.StrikeContext;
import com.fightsight.common.stats.SessionSummary;

import java.util.List;

public record EnrichmentResult(List<StrikeContext> contexts, SessionSummary summary) {

    public EnrichmentResult {
        contexts = List.copyOf(contexts);
    }
}

package com.fightsight.common.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fightsight.common.model.FighterLabel;

import java.util.Map;

/**
 * Session-level aggregate handed to the report generator.
 */
public record SessionSummary(
    @JsonProperty("totalStrikes") int totalStrikes,
    @JsonProperty("totalCombinations") int totalCombinations,
    @JsonProperty("durationSeconds") double durationSeconds,
    @JsonProperty("strikesPerMinute") double strikesPerMinute,
    @JsonProperty("averageCombinationLength") double averageCombinationLength,
    @JsonProperty("fighters") Map<FighterLabel, FighterStats> fighters
) {}

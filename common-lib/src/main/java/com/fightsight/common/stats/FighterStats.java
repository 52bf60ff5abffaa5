package com.fightsight.common.stats;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.StrikeCategory;
import com.fightsight.common.model.TargetZone;

import java.util.Map;

public record FighterStats(
    @JsonProperty("label") FighterLabel label,
    @JsonProperty("strikesThrown") int strikesThrown,
    @JsonProperty("strikesLanded") int strikesLanded,
    @JsonProperty("strikesReceived") int strikesReceived,
    @JsonProperty("strikesAbsorbed") int strikesAbsorbed,
    @JsonProperty("combinationsThrown") int combinationsThrown,
    @JsonProperty("counterStrikes") int counterStrikes,
    @JsonProperty("accuracy") double accuracy,
    @JsonProperty("byCategory") Map<StrikeCategory, Integer> byCategory,
    @JsonProperty("byTarget") Map<TargetZone, Integer> byTarget
) {}

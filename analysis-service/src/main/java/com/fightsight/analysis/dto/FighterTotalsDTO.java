package com.fightsight.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fightsight.analysis.model.SessionFighter;
import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.Stance;

public record FighterTotalsDTO(
    @JsonProperty("id")                 Long id,
    @JsonProperty("label")              FighterLabel label,
    @JsonProperty("displayName")        String displayName,
    @JsonProperty("stance")             Stance stance,
    @JsonProperty("fighterProfileId")   String fighterProfileId,
    @JsonProperty("strikesThrown")      Integer strikesThrown,
    @JsonProperty("strikesLanded")      Integer strikesLanded,
    @JsonProperty("strikesReceived")    Integer strikesReceived,
    @JsonProperty("combinationsThrown") Integer combinationsThrown
) {
    public static FighterTotalsDTO from(SessionFighter f) {
        return new FighterTotalsDTO(f.getId(), f.getLabel(), f.getDisplayName(), f.getStance(),
            f.getFighterProfileId(), f.getStrikesThrown(), f.getStrikesLanded(),
            f.getStrikesReceived(), f.getCombinationsThrown());
    }
}

package com.fightsight.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fightsight.common.model.CombatSport;
import com.fightsight.common.model.Stance;

/**
 * Intake payload: one uploaded video and its two participants.
 */
public record CreateSessionRequest(
    @JsonProperty("videoId")        String videoId,
    @JsonProperty("framesLocation") String framesLocation,
    @JsonProperty("sportType")      CombatSport sportType,
    @JsonProperty("roundCount")     Integer roundCount,
    @JsonProperty("fighterA")       FighterSpec fighterA,
    @JsonProperty("fighterB")       FighterSpec fighterB
) {
    public record FighterSpec(
        @JsonProperty("displayName")      String displayName,
        @JsonProperty("stance")           Stance stance,
        @JsonProperty("fighterProfileId") String fighterProfileId
    ) {}
}

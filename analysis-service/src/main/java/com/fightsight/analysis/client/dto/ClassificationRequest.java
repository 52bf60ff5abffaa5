package com.fightsight.analysis.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fightsight.common.model.CombatSport;
import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.FrameWindow;
import com.fightsight.common.model.Limb;

/**
 * Classifier input: three frame images around the candidate plus what the detector
 * already knows about it.
 */
public record ClassificationRequest(
    @JsonProperty("session_id") Long sessionId,
    @JsonProperty("sport_type") CombatSport sportType,
    @JsonProperty("thrower") FighterLabel thrower,
    @JsonProperty("receiver") FighterLabel receiver,
    @JsonProperty("limb") Limb limb,
    @JsonProperty("timestamp_seconds") double timestampSeconds,
    @JsonProperty("frame_indices") FrameWindow frameIndices,
    @JsonProperty("frame_images") FrameImages frameImages
) {
    public record FrameImages(
        @JsonProperty("before") String before,
        @JsonProperty("during") String during,
        @JsonProperty("after") String after
    ) {}
}

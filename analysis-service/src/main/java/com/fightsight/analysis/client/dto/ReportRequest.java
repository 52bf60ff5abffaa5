package com.fightsight.analysis.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fightsight.common.model.CombatSport;
import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.InitiationType;
import com.fightsight.common.model.RangeBucket;
import com.fightsight.common.model.StrikeCategory;
import com.fightsight.common.model.StrikeOutcome;
import com.fightsight.common.model.TargetZone;
import com.fightsight.common.stats.SessionSummary;

import java.util.List;

/**
 * Everything the report generator sees about a completed session.
 */
public record ReportRequest(
    @JsonProperty("session_id") Long sessionId,
    @JsonProperty("sport_type") CombatSport sportType,
    @JsonProperty("round_count") Integer roundCount,
    @JsonProperty("summary") SessionSummary summary,
    @JsonProperty("strikes") List<StrikeLine> strikes,
    @JsonProperty("combinations") List<CombinationLine> combinations
) {
    public record StrikeLine(
        @JsonProperty("sequence_number") int sequenceNumber,
        @JsonProperty("timestamp_seconds") double timestampSeconds,
        @JsonProperty("thrower") FighterLabel thrower,
        @JsonProperty("category") StrikeCategory category,
        @JsonProperty("technique") String technique,
        @JsonProperty("target_zone") TargetZone targetZone,
        @JsonProperty("outcome") StrikeOutcome outcome,
        @JsonProperty("range") RangeBucket range,
        @JsonProperty("initiation") InitiationType initiation,
        @JsonProperty("position_in_combination") Integer positionInCombination
    ) {}

    public record CombinationLine(
        @JsonProperty("thrower") FighterLabel thrower,
        @JsonProperty("start_timestamp") double startTimestamp,
        @JsonProperty("strike_count") int strikeCount,
        @JsonProperty("landed_count") int landedCount
    ) {}
}

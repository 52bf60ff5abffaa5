package com.fightsight.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A stored combination with its member strike ids in sequence order.
 */
public record CombinationDTO(
    @JsonProperty("id")              Long id,
    @JsonProperty("throwerId")       Long throwerId,
    @JsonProperty("startTimestamp")  Double startTimestamp,
    @JsonProperty("endTimestamp")    Double endTimestamp,
    @JsonProperty("durationSeconds") Double durationSeconds,
    @JsonProperty("strikeCount")     Integer strikeCount,
    @JsonProperty("landedCount")     Integer landedCount,
    @JsonProperty("missedCount")     Integer missedCount,
    @JsonProperty("strikeEventIds")  List<Long> strikeEventIds
) {}

package com.fightsight.analysis.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record GeneratedReport(
    @JsonProperty("narrative") String narrative,
    @JsonProperty("key_insights") List<String> keyInsights,
    @JsonProperty("strengths") List<String> strengths,
    @JsonProperty("areas_for_improvement") List<String> areasForImprovement,
    @JsonProperty("cost") double cost
) {}

package com.fightsight.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record ReportDTO(
    @JsonProperty("sessionId")           Long sessionId,
    @JsonProperty("narrative")           String narrative,
    @JsonProperty("keyInsights")         List<String> keyInsights,
    @JsonProperty("strengths")           List<String> strengths,
    @JsonProperty("areasForImprovement") List<String> areasForImprovement,
    @JsonProperty("generationCost")      Double generationCost,
    @JsonProperty("createdAt")           LocalDateTime createdAt
) {}

package com.fightsight.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fightsight.analysis.model.AnalysisSession;
import com.fightsight.common.model.AnalysisStatus;
import com.fightsight.common.model.CombatSport;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Session status, progress and frozen totals as seen by API callers.
 */
public record SessionStatusDTO(
    @JsonProperty("id")                  Long id,
    @JsonProperty("videoId")             String videoId,
    @JsonProperty("sportType")           CombatSport sportType,
    @JsonProperty("roundCount")          Integer roundCount,
    @JsonProperty("status")              AnalysisStatus status,
    @JsonProperty("progressPercentage")  Integer progressPercentage,
    @JsonProperty("totalFrames")         Integer totalFrames,
    @JsonProperty("skippedFrames")       Integer skippedFrames,
    @JsonProperty("totalCandidates")     Integer totalCandidates,
    @JsonProperty("classifiedCount")     Integer classifiedCount,
    @JsonProperty("falsePositiveCount")  Integer falsePositiveCount,
    @JsonProperty("failedCount")         Integer failedCount,
    @JsonProperty("totalStrikes")        Integer totalStrikes,
    @JsonProperty("totalCombinations")   Integer totalCombinations,
    @JsonProperty("classificationCalls") Integer classificationCalls,
    @JsonProperty("totalCost")           Double totalCost,
    @JsonProperty("processingTimeMs")    Long processingTimeMs,
    @JsonProperty("createdAt")           LocalDateTime createdAt,
    @JsonProperty("startedAt")           LocalDateTime startedAt,
    @JsonProperty("completedAt")         LocalDateTime completedAt,
    @JsonProperty("failedAt")            LocalDateTime failedAt,
    @JsonProperty("errorMessage")        String errorMessage,
    @JsonProperty("fighters")            List<FighterTotalsDTO> fighters
) {
    public static SessionStatusDTO from(AnalysisSession s, List<FighterTotalsDTO> fighters) {
        return new SessionStatusDTO(s.getId(), s.getVideoId(), s.getSportType(), s.getRoundCount(),
            s.getStatus(), s.getProgressPercentage(), s.getTotalFrames(), s.getSkippedFrames(),
            s.getTotalCandidates(), s.getClassifiedCount(), s.getFalsePositiveCount(), s.getFailedCount(),
            s.getTotalStrikes(), s.getTotalCombinations(), s.getClassificationCalls(), s.getTotalCost(),
            s.getProcessingTimeMs(), s.getCreatedAt(), s.getStartedAt(), s.getCompletedAt(),
            s.getFailedAt(), s.getErrorMessage(), fighters);
    }
}

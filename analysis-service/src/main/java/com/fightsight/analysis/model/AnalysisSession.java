package com.fightsight.analysis.model;

import com.fightsight.common.model.AnalysisStatus;
import com.fightsight.common.model.CombatSport;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One analysis run over one uploaded video.
 *
 * <p>Status and progress are written only by the pipeline that owns the session.
 * Once the status is terminal, the totals below are frozen and equal the sums over
 * the session's strike events, combinations and classification calls.
 */
@Data
@NoArgsConstructor
@Table("analysis_sessions")
public class AnalysisSession {

    @Id
    private Long id;

    /** Identifier of the video in the external storage service. */
    private String videoId;

    /** Where the pose source finds the extracted frames for this video. */
    private String framesLocation;

    private CombatSport sportType;

    private Integer roundCount;

    private AnalysisStatus status;

    private Integer progressPercentage;

    // ── totals (frozen on terminal status) ──

    private Double totalCost;

    private Integer classificationCalls;

    private Integer totalCandidates;

    private Integer classifiedCount;

    private Integer falsePositiveCount;

    private Integer failedCount;

    private Integer totalFrames;

    private Integer skippedFrames;

    private Integer totalStrikes;

    private Integer totalCombinations;

    private Long processingTimeMs;

    // ── lifecycle timestamps ──

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    private LocalDateTime failedAt;

    private String errorMessage;
}

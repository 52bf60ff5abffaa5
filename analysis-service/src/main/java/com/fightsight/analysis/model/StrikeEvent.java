package com.fightsight.analysis.model;

import com.fightsight.common.model.InitiationType;
import com.fightsight.common.model.Limb;
import com.fightsight.common.model.RangeBucket;
import com.fightsight.common.model.Stance;
import com.fightsight.common.model.StrikeCategory;
import com.fightsight.common.model.StrikeOutcome;
import com.fightsight.common.model.TargetZone;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A classified strike.
 *
 * <p>Detection and classification fields are written once. Only the enrichment block
 * and the combination linkage are updated afterwards.
 */
@Data
@NoArgsConstructor
@Table("strike_events")
public class StrikeEvent {

    @Id
    private Long id;

    private Long sessionId;

    private Long throwerId;

    private Long receiverId;

    private Double timestampSeconds;

    private Integer frameNumber;

    // ── detection ──

    private Limb limb;

    private Double velocity;

    private Double fighterDistance;

    private Double detectionConfidence;

    // ── classification ──

    private Stance stance;

    private StrikeCategory category;

    private String technique;

    private String modifier;

    private TargetZone targetZone;

    private StrikeOutcome outcome;

    private Double classificationConfidence;

    private String reasoning;

    private Double classificationCost;

    // ── enrichment ──

    private Integer sequenceNumber;

    private Double secondsSincePrevious;

    private RangeBucket rangeBucket;

    private InitiationType initiation;

    private Boolean inCombination;

    private Long combinationId;

    private Integer positionInCombination;

    private LocalDateTime createdAt;
}

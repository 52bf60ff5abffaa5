package com.fightsight.analysis.client.dto;

import com.fightsight.common.model.Stance;
import com.fightsight.common.model.StrikeCategory;
import com.fightsight.common.model.StrikeOutcome;
import com.fightsight.common.model.TargetZone;

/**
 * Validated classifier verdict. When {@code strikeDetected} is false every
 * classification field is {@code null} and only {@code cost} is meaningful.
 */
public record ClassificationResponse(
    boolean strikeDetected,
    Stance stance,
    StrikeCategory category,
    String technique,
    String modifier,
    TargetZone targetZone,
    StrikeOutcome outcome,
    Double confidence,
    String reasoning,
    double cost
) {
    public static ClassificationResponse falsePositive(double cost) {
        return new ClassificationResponse(false, null, null, null, null, null, null, null, null, cost);
    }
}

package com.fightsight.common.model;

/**
 * Classified strike as seen by the pure post-classification stages (clustering,
 * enrichment, aggregation). Carries only what those stages read.
 *
 * @param id              persisted strike id, {@code null} before persistence
 * @param fighterDistance torso-centre distance at detection time, may be {@code null}
 */
public record StrikeRecord(
    Long id,
    FighterLabel thrower,
    double timestampSeconds,
    int frameNumber,
    Limb limb,
    StrikeCategory category,
    TargetZone targetZone,
    StrikeOutcome outcome,
    Double fighterDistance
) {
    public FighterLabel receiver() {
        return thrower.opponent();
    }

    public boolean landed() {
        return outcome != null && outcome.isLanded();
    }
}

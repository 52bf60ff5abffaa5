package com.fightsight.common.model;

/**
 * Unconfirmed strike proposed by motion analysis. Lives only between detection and
 * classification and is never persisted.
 *
 * @param fighterDistance torso-centre distance between the fighters at the candidate frame,
 *                        {@code null} when the opponent was not visible
 */
public record StrikeCandidate(
    FighterLabel thrower,
    Limb limb,
    int frameIndex,
    double timestampSeconds,
    double velocity,
    double confidence,
    FrameWindow window,
    Double fighterDistance
) {
    public FighterLabel receiver() {
        return thrower.opponent();
    }
}

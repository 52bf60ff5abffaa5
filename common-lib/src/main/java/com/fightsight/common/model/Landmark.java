package com.fightsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One joint position in normalised image coordinates, with the pose model's visibility score.
 */
public record Landmark(
    @JsonProperty("x") double x,
    @JsonProperty("y") double y,
    @JsonProperty("z") double z,
    @JsonProperty("visibility") double visibility
) {
    public boolean isVisible(double minVisibility) {
        return visibility >= minVisibility;
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z) && Double.isFinite(visibility);
    }

    /** Planar (x, y) distance; depth is too noisy to take part in motion measurement. */
    public double distanceTo(Landmark other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}

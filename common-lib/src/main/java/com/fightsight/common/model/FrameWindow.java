package com.fightsight.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Frame indices around a candidate: before, during and after the suspected strike.
 */
public record FrameWindow(
    @JsonProperty("before") int before,
    @JsonProperty("during") int during,
    @JsonProperty("after") int after
) {}

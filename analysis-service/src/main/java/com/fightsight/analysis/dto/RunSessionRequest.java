package com.fightsight.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Optional body of a run request; a blank location keeps the stored one. */
public record RunSessionRequest(
    @JsonProperty("framesLocation") String framesLocation
) {}

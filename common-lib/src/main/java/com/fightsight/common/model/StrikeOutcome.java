package com.fightsight.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What happened to a strike. Only {@link #LANDED_CLEAN} and {@link #PARTIALLY_LANDED}
 * count as landed; every other outcome counts as missed in combination statistics.
 */
public enum StrikeOutcome {
    LANDED_CLEAN,
    PARTIALLY_LANDED,
    BLOCKED,
    SLIPPED,
    PARRIED,
    ROLLED,
    MISSED,
    COUNTERED;

    public boolean isLanded() {
        return this == LANDED_CLEAN || this == PARTIALLY_LANDED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StrikeOutcome fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("StrikeOutcome value must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

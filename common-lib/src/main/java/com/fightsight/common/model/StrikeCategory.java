package com.fightsight.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StrikeCategory {
    HAND,
    KICK,
    ELBOW,
    KNEE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StrikeCategory fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("StrikeCategory value must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

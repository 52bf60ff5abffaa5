package com.fightsight.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse distance between the fighters when a strike was thrown.
 */
public enum RangeBucket {
    CLOSE,
    MID,
    LONG;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RangeBucket fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RangeBucket value must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

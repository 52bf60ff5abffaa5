package com.fightsight.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Stance {
    ORTHODOX,
    SOUTHPAW,
    SWITCH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Stance fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Stance value must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

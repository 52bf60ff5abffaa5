package com.fightsight.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Sport the sparring video was recorded in.
 */
public enum CombatSport {
    BOXING,
    KICKBOXING,
    MUAY_THAI,
    MMA,
    KARATE,
    TAEKWONDO;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CombatSport fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CombatSport value must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

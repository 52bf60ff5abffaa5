package com.fightsight.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether a strike opened an exchange or answered the opponent's last strike.
 */
public enum InitiationType {
    OFFENSE,
    COUNTER,
    DEFENSIVE_RESPONSE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InitiationType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("InitiationType value must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package com.fightsight.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Stable identifier of the two participants in a session. Label order
 * ({@code FIGHTER_A} before {@code FIGHTER_B}) is part of the canonical strike ordering.
 */
public enum FighterLabel {
    FIGHTER_A,
    FIGHTER_B;

    public FighterLabel opponent() {
        return this == FIGHTER_A ? FIGHTER_B : FIGHTER_A;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FighterLabel fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Fighter label must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** Like {@link #fromWire} but empty for keys that name neither fighter. */
    public static Optional<FighterLabel> lookup(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(fromWire(value));
        } catch (IllegalArgumentException unknown) {
            return Optional.empty();
        }
    }
}

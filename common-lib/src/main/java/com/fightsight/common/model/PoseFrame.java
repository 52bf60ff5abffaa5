package com.fightsight.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.Map;

/**
 * Pose source output for one extracted frame. A person the pose model did not
 * detect has no entry in {@code persons}.
 *
 * <p>{@code unrecognizedPersons} counts person keys in the payload that name neither
 * fighter; the detector treats such a frame as malformed.
 */
public record PoseFrame(
    int frameIndex,
    double timestampSeconds,
    Map<FighterLabel, PoseLandmarks> persons,
    @JsonIgnore int unrecognizedPersons
) {
    public PoseFrame(int frameIndex, double timestampSeconds, Map<FighterLabel, PoseLandmarks> persons) {
        this(frameIndex, timestampSeconds, persons, 0);
    }

    @JsonCreator
    public static PoseFrame fromWire(@JsonProperty("frameIndex") int frameIndex,
                                     @JsonProperty("timestampSeconds") double timestampSeconds,
                                     @JsonProperty("persons") Map<String, PoseLandmarks> persons) {
        if (persons == null) {
            return new PoseFrame(frameIndex, timestampSeconds, null, 0);
        }
        Map<FighterLabel, PoseLandmarks> known = new EnumMap<>(FighterLabel.class);
        int unrecognized = 0;
        for (Map.Entry<String, PoseLandmarks> entry : persons.entrySet()) {
            FighterLabel label = FighterLabel.lookup(entry.getKey()).orElse(null);
            if (label == null) {
                unrecognized++;
            } else {
                known.put(label, entry.getValue());
            }
        }
        return new PoseFrame(frameIndex, timestampSeconds, known, unrecognized);
    }

    public PoseLandmarks person(FighterLabel label) {
        return persons == null ? null : persons.get(label);
    }
}

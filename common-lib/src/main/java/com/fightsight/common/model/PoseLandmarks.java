package com.fightsight.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Skeleton of one tracked person in one frame. Missing joints are simply absent.
 */
public final class PoseLandmarks {

    private static final List<PoseJoint> TORSO = List.of(
        PoseJoint.LEFT_SHOULDER, PoseJoint.RIGHT_SHOULDER, PoseJoint.LEFT_HIP, PoseJoint.RIGHT_HIP);

    private final Map<PoseJoint, Landmark> joints;

    public PoseLandmarks(Map<PoseJoint, Landmark> joints) {
        EnumMap<PoseJoint, Landmark> copy = new EnumMap<>(PoseJoint.class);
        if (joints != null) {
            joints.forEach((joint, landmark) -> {
                if (joint != null && landmark != null) {
                    copy.put(joint, landmark);
                }
            });
        }
        this.joints = Collections.unmodifiableMap(copy);
    }

    /**
     * Decodes the pose source's joint map. Joints outside {@link PoseJoint} are dropped.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PoseLandmarks fromWire(Map<String, Landmark> wire) {
        Map<PoseJoint, Landmark> known = new EnumMap<>(PoseJoint.class);
        if (wire != null) {
            wire.forEach((key, landmark) ->
                PoseJoint.lookup(key).ifPresent(joint -> known.put(joint, landmark)));
        }
        return new PoseLandmarks(known);
    }

    public Landmark get(PoseJoint joint) {
        return joints.get(joint);
    }

    public boolean isVisible(PoseJoint joint, double minVisibility) {
        Landmark landmark = joints.get(joint);
        return landmark != null && landmark.isVisible(minVisibility);
    }

    public boolean isFinite() {
        return joints.values().stream().allMatch(Landmark::isFinite);
    }

    public boolean isEmpty() {
        return joints.isEmpty();
    }

    /**
     * Mean position of the visible shoulders and hips, or empty when none is visible.
     */
    public Optional<Landmark> torsoCenter(double minVisibility) {
        double sumX = 0.0;
        double sumY = 0.0;
        int count = 0;
        for (PoseJoint joint : TORSO) {
            Landmark landmark = joints.get(joint);
            if (landmark != null && landmark.isVisible(minVisibility)) {
                sumX += landmark.x();
                sumY += landmark.y();
                count++;
            }
        }
        if (count == 0) {
            return Optional.empty();
        }
        return Optional.of(new Landmark(sumX / count, sumY / count, 0.0, 1.0));
    }

    @JsonValue
    public Map<PoseJoint, Landmark> joints() {
        return joints;
    }
}

package com.fightsight.common.model;

/**
 * Anatomical limb tracked by the candidate detector. Lead/rear is unknown at
 * detection time, so limbs are named by body side.
 */
public enum Limb {
    LEFT_ARM(PoseJoint.LEFT_SHOULDER, PoseJoint.LEFT_ELBOW, PoseJoint.LEFT_WRIST),
    RIGHT_ARM(PoseJoint.RIGHT_SHOULDER, PoseJoint.RIGHT_ELBOW, PoseJoint.RIGHT_WRIST),
    LEFT_LEG(PoseJoint.LEFT_HIP, PoseJoint.LEFT_KNEE, PoseJoint.LEFT_ANKLE),
    RIGHT_LEG(PoseJoint.RIGHT_HIP, PoseJoint.RIGHT_KNEE, PoseJoint.RIGHT_ANKLE);

    private final PoseJoint proximal;
    private final PoseJoint mid;
    private final PoseJoint distal;

    Limb(PoseJoint proximal, PoseJoint mid, PoseJoint distal) {
        this.proximal = proximal;
        this.mid      = mid;
        this.distal   = distal;
    }

    public PoseJoint proximal() { return proximal; }
    public PoseJoint mid()      { return mid; }
    public PoseJoint distal()   { return distal; }
}

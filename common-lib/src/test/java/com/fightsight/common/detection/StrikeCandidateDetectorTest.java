package com.fightsight.common.detection;

import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.Landmark;
import com.fightsight.common.model.Limb;
import com.fightsight.common.model.PoseFrame;
import com.fightsight.common.model.PoseJoint;
import com.fightsight.common.model.PoseLandmarks;
import com.fightsight.common.model.StrikeCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link StrikeCandidateDetector} using hand-placed skeletons.
 * Fighter A stands on the left (x ≈ 0.3) and throws to the right; fighter B's torso sits at x ≈ 0.725.
 */
class StrikeCandidateDetectorTest {

    private static final double VISIBLE   = 0.9;
    private static final double INVISIBLE = 0.1;

    private final StrikeCandidateDetector detector = new StrikeCandidateDetector(DetectorSettings.defaults());

    // ── basic velocity and extension ───────────────────────────────────────

    @Nested
    @DisplayName("detect() — velocity and extension")
    class VelocityAndExtension {

        @Test
        @DisplayName("fast extending jab toward the opponent → one RIGHT_ARM candidate")
        void extendingJab_producesCandidate() {
            List<PoseFrame> frames = List.of(
                frame(0, 0.000, rightArm(0.35, VISIBLE), opponentRight()),
                frame(1, 0.033, rightArm(0.50, VISIBLE), opponentRight()));

            DetectionResult result = detector.detect(frames);

            assertEquals(1, result.candidates().size());
            StrikeCandidate candidate = result.candidates().get(0);
            assertEquals(FighterLabel.FIGHTER_A, candidate.thrower());
            assertEquals(FighterLabel.FIGHTER_B, candidate.receiver());
            assertEquals(Limb.RIGHT_ARM, candidate.limb());
            assertEquals(1, candidate.frameIndex());
            assertEquals(0.033, candidate.timestampSeconds(), 1e-9);
            assertEquals(0.15, candidate.velocity(), 1e-9);
            assertEquals(1.0, candidate.confidence(), 1e-9);
            assertEquals(0, candidate.window().before());
            assertEquals(1, candidate.window().during());
            assertEquals(1, candidate.window().after());
        }

        @Test
        @DisplayName("fighter distance = own torso centre to opponent torso centre")
        void fighterDistance_measuredBetweenTorsoCentres() {
            List<PoseFrame> frames = List.of(
                frame(0, 0.0, rightArm(0.35, VISIBLE), opponentRight()),
                frame(1, 0.1, rightArm(0.50, VISIBLE), opponentRight()));

            StrikeCandidate candidate = detector.detect(frames).candidates().get(0);

            // own torso centre is the right shoulder (0.3, 0.5); opponent centre (0.725, 0.5)
            assertNotNull(candidate.fighterDistance());
            assertEquals(0.425, candidate.fighterDistance(), 1e-9);
        }

        @Test
        @DisplayName("window.after points at the next valid frame when one exists")
        void windowAfter_isNextFrame() {
            List<PoseFrame> frames = List.of(
                frame(10, 0.0, rightArm(0.35, VISIBLE), opponentRight()),
                frame(11, 0.1, rightArm(0.50, VISIBLE), opponentRight()),
                frame(12, 0.2, rightArm(0.50, VISIBLE), opponentRight()));

            StrikeCandidate candidate = detector.detect(frames).candidates().get(0);

            assertEquals(10, candidate.window().before());
            assertEquals(11, candidate.window().during());
            assertEquals(12, candidate.window().after());
        }

        @Test
        @DisplayName("displacement below threshold → no candidate")
        void slowMovement_noCandidate() {
            List<PoseFrame> frames = List.of(
                frame(0, 0.0, rightArm(0.35, VISIBLE), opponentRight()),
                frame(1, 0.1, rightArm(0.38, VISIBLE), opponentRight()));

            assertTrue(detector.detect(frames).candidates().isEmpty());
        }

        @Test
        @DisplayName("fast retraction (reach shrinking) → no candidate")
        void retraction_noCandidate() {
            List<PoseFrame> frames = List.of(
                frame(0, 0.0, rightArm(0.50, VISIBLE), opponentRight()),
                frame(1, 0.1, rightArm(0.35, VISIBLE), opponentRight()));

            assertTrue(detector.detect(frames).candidates().isEmpty());
        }

        @Test
        @DisplayName("extension pointing away from the opponent → no candidate")
        void extensionAwayFromOpponent_noCandidate() {
            List<PoseFrame> frames = List.of(
                frame(0, 0.0, rightArm(0.35, VISIBLE), opponentAt(0.05)),
                frame(1, 0.1, rightArm(0.50, VISIBLE), opponentAt(0.05)));

            assertTrue(detector.detect(frames).candidates().isEmpty());
        }

        @Test
        @DisplayName("opponent not in frame → extension alone decides, distance unknown")
        void noOpponent_distanceNull() {
            List<PoseFrame> frames = List.of(
                frame(0, 0.0, rightArm(0.35, VISIBLE), null),
                frame(1, 0.1, rightArm(0.50, VISIBLE), null));

            List<StrikeCandidate> candidates = detector.detect(frames).candidates();

            assertEquals(1, candidates.size());
            assertNull(candidates.get(0).fighterDistance());
        }
    }

    // ── visibility ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("detect() — landmark visibility")
    class Visibility {

        @Test
        @DisplayName("wrist hidden → elbow motion is used instead")
        void hiddenWrist_fallsBackToElbow() {
            List<PoseFrame> frames = List.of(
                frame(0, 0.0, arm(0.30, 0.35, 0.40, INVISIBLE, VISIBLE), opponentRight()),
                frame(1, 0.1, arm(0.30, 0.45, 0.40, INVISIBLE, VISIBLE), opponentRight()));

            List<StrikeCandidate> candidates = detector.detect(frames).candidates();

            assertEquals(1, candidates.size());
            assertEquals(0.10, candidates.get(0).velocity(), 1e-9);
        }

        @Test
        @DisplayName("wrist and elbow both hidden → no candidate")
        void wristAndElbowHidden_noCandidate() {
            List<PoseFrame> frames = List.of(
                frame(0, 0.0, arm(0.30, 0.35, 0.35, INVISIBLE, INVISIBLE), opponentRight()),
                frame(1, 0.1, arm(0.30, 0.50, 0.50, INVISIBLE, INVISIBLE), opponentRight()));

            assertTrue(detector.detect(frames).candidates().isEmpty());
        }

        @Test
        @DisplayName("shoulder hidden → extension cannot be confirmed, no candidate")
        void hiddenShoulder_noCandidate() {
            Map<PoseJoint, Landmark> before = arm(0.30, 0.35, 0.35, VISIBLE, VISIBLE);
            Map<PoseJoint, Landmark> after  = arm(0.30, 0.50, 0.50, VISIBLE, VISIBLE);
            before.put(PoseJoint.RIGHT_SHOULDER, new Landmark(0.30, 0.5, 0.0, INVISIBLE));
            after.put(PoseJoint.RIGHT_SHOULDER, new Landmark(0.30, 0.5, 0.0, INVISIBLE));

            List<PoseFrame> frames = List.of(
                frame(0, 0.0, before, opponentRight()),
                frame(1, 0.1, after, opponentRight()));

            assertTrue(detector.detect(frames).candidates().isEmpty());
        }
    }

    // ── refractory collapse ────────────────────────────────────────────────

    @Nested
    @DisplayName("detect() — refractory collapse")
    class Refractory {

        @Test
        @DisplayName("one physical strike spread over three frames → single candidate at peak velocity")
        void consecutiveFrames_collapseToPeak() {
            List<PoseFrame> frames = List.of(
                frame(0, 0.0, rightArm(0.35, VISIBLE), opponentRight()),
                frame(1, 0.1, rightArm(0.42, VISIBLE), opponentRight()),
                frame(2, 0.2, rightArm(0.52, VISIBLE), opponentRight()),
                frame(3, 0.3, rightArm(0.58, VISIBLE), opponentRight()));

            List<StrikeCandidate> candidates = detector.detect(frames).candidates();

            assertEquals(1, candidates.size());
            assertEquals(2, candidates.get(0).frameIndex());
            assertEquals(0.10, candidates.get(0).velocity(), 1e-9);
        }

        @Test
        @DisplayName("two strikes separated by more than the refractory period stay separate")
        void separatedStrikes_bothKept() {
            List<PoseFrame> frames = List.of(
                frame(0, 0.0, rightArm(0.35, VISIBLE), opponentRight()),
                frame(1, 0.1, rightArm(0.50, VISIBLE), opponentRight()),
                frame(2, 0.9, rightArm(0.35, VISIBLE), opponentRight()),
                frame(3, 1.0, rightArm(0.50, VISIBLE), opponentRight()));

            List<StrikeCandidate> candidates = detector.detect(frames).candidates();

            assertEquals(2, candidates.size());
            assertEquals(1, candidates.get(0).frameIndex());
            assertEquals(3, candidates.get(1).frameIndex());
        }

        @Test
        @DisplayName("collapse never merges different limbs")
        void differentLimbs_notMerged() {
            StrikeCandidate right = candidate(Limb.RIGHT_ARM, 0.10, 0.2);
            StrikeCandidate left  = candidate(Limb.LEFT_ARM, 0.15, 0.2);

            List<StrikeCandidate> result = detector.collapseRefractory(new ArrayList<>(List.of(right, left)));

            assertEquals(2, result.size());
        }

        @Test
        @DisplayName("equal peak velocities → earliest candidate wins")
        void tiedVelocity_earliestWins() {
            StrikeCandidate first  = candidate(Limb.RIGHT_ARM, 0.10, 0.20);
            StrikeCandidate second = candidate(Limb.RIGHT_ARM, 0.20, 0.20);

            List<StrikeCandidate> result = detector.collapseRefractory(new ArrayList<>(List.of(second, first)));

            assertEquals(1, result.size());
            assertEquals(0.10, result.get(0).timestampSeconds(), 1e-9);
        }
    }

    // ── malformed input ────────────────────────────────────────────────────

    @Nested
    @DisplayName("detect() — malformed frames")
    class MalformedFrames {

        @Test
        @DisplayName("null or empty input → empty result")
        void emptyInput() {
            assertEquals(0, detector.detect(null).totalFrames());
            assertTrue(detector.detect(List.of()).candidates().isEmpty());
        }

        @Test
        @DisplayName("non-finite landmarks, backwards timestamps and missing persons are skipped, not fatal")
        void malformedFrames_skippedAndCounted() {
            Map<PoseJoint, Landmark> broken = rightArm(0.45, VISIBLE);
            broken.put(PoseJoint.RIGHT_WRIST, new Landmark(Double.NaN, 0.5, 0.0, VISIBLE));

            List<PoseFrame> frames = new ArrayList<>();
            frames.add(frame(0, 0.0, rightArm(0.35, VISIBLE), opponentRight()));
            frames.add(frame(1, 0.05, broken, opponentRight()));
            frames.add(new PoseFrame(2, 0.06, null));
            frames.add(frame(3, -1.0, rightArm(0.40, VISIBLE), opponentRight()));
            frames.add(frame(4, 0.1, rightArm(0.50, VISIBLE), opponentRight()));

            DetectionResult result = detector.detect(frames);

            assertEquals(2, result.framesAnalyzed());
            assertEquals(3, result.framesSkipped());
            assertEquals(5, result.totalFrames());
            assertEquals(1, result.candidates().size());
            assertEquals(4, result.candidates().get(0).frameIndex());
        }

        @Test
        @DisplayName("a frame carrying an unrecognized person is skipped, its neighbours still analyzed")
        void unrecognizedPerson_skipsOnlyThatFrame() {
            PoseFrame first = frame(0, 0.0, rightArm(0.35, VISIBLE), opponentRight());
            PoseFrame odd = frame(1, 0.05, rightArm(0.40, VISIBLE), opponentRight());
            PoseFrame withStranger = new PoseFrame(odd.frameIndex(), odd.timestampSeconds(), odd.persons(), 1);
            PoseFrame last = frame(2, 0.1, rightArm(0.50, VISIBLE), opponentRight());

            DetectionResult result = detector.detect(List.of(first, withStranger, last));

            assertEquals(2, result.framesAnalyzed());
            assertEquals(1, result.framesSkipped());
            assertEquals(1, result.candidates().size());
            assertEquals(2, result.candidates().get(0).frameIndex());
        }

        @Test
        @DisplayName("frames where nobody was detected are valid but yield nothing")
        void emptyPersons_valid() {
            List<PoseFrame> frames = List.of(
                new PoseFrame(0, 0.0, Map.of()),
                new PoseFrame(1, 0.1, Map.of()));

            DetectionResult result = detector.detect(frames);

            assertEquals(2, result.framesAnalyzed());
            assertEquals(0, result.framesSkipped());
            assertTrue(result.candidates().isEmpty());
        }
    }

    // ── fixtures ───────────────────────────────────────────────────────────

    private static PoseFrame frame(int index, double timestamp,
                                   Map<PoseJoint, Landmark> fighterA, Map<PoseJoint, Landmark> fighterB) {
        Map<FighterLabel, PoseLandmarks> persons = new EnumMap<>(FighterLabel.class);
        persons.put(FighterLabel.FIGHTER_A, new PoseLandmarks(fighterA));
        if (fighterB != null) {
            persons.put(FighterLabel.FIGHTER_B, new PoseLandmarks(fighterB));
        }
        return new PoseFrame(index, timestamp, persons);
    }

    /** Right arm with shoulder at (0.30, 0.5), elbow midway, wrist at {@code wristX}. */
    private static Map<PoseJoint, Landmark> rightArm(double wristX, double visibility) {
        return arm(0.30, (0.30 + wristX) / 2.0, wristX, visibility, visibility);
    }

    private static Map<PoseJoint, Landmark> arm(double shoulderX, double elbowX, double wristX,
                                                double wristVisibility, double elbowVisibility) {
        Map<PoseJoint, Landmark> joints = new HashMap<>();
        joints.put(PoseJoint.RIGHT_SHOULDER, new Landmark(shoulderX, 0.5, 0.0, VISIBLE));
        joints.put(PoseJoint.RIGHT_ELBOW, new Landmark(elbowX, 0.5, 0.0, elbowVisibility));
        joints.put(PoseJoint.RIGHT_WRIST, new Landmark(wristX, 0.5, 0.0, wristVisibility));
        return joints;
    }

    private static Map<PoseJoint, Landmark> opponentRight() {
        return opponentAt(0.70);
    }

    /** Opponent torso, 0.05 wide, starting at {@code x}; no limbs, so the opponent never throws. */
    private static Map<PoseJoint, Landmark> opponentAt(double x) {
        Map<PoseJoint, Landmark> joints = new HashMap<>();
        joints.put(PoseJoint.LEFT_SHOULDER, new Landmark(x, 0.4, 0.0, VISIBLE));
        joints.put(PoseJoint.RIGHT_SHOULDER, new Landmark(x + 0.05, 0.4, 0.0, VISIBLE));
        joints.put(PoseJoint.LEFT_HIP, new Landmark(x, 0.6, 0.0, VISIBLE));
        joints.put(PoseJoint.RIGHT_HIP, new Landmark(x + 0.05, 0.6, 0.0, VISIBLE));
        return joints;
    }

    private static StrikeCandidate candidate(Limb limb, double timestamp, double velocity) {
        return new StrikeCandidate(FighterLabel.FIGHTER_A, limb, (int) Math.round(timestamp * 30),
            timestamp, velocity, 1.0, null, null);
    }
}

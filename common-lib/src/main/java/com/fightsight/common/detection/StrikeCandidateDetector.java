package com.fightsight.common.detection;

import com.fightsight.common.combination.StrikeOrdering;
import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.FrameWindow;
import com.fightsight.common.model.Landmark;
import com.fightsight.common.model.Limb;
import com.fightsight.common.model.PoseFrame;
import com.fightsight.common.model.PoseJoint;
import com.fightsight.common.model.PoseLandmarks;
import com.fightsight.common.model.StrikeCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns consecutive pose frames into strike candidates using velocity and limb-extension analysis.
 *
 * <p>For every consecutive frame pair, tracked fighter and limb:
 * <ol>
 *   <li>Pick the motion joint: the distal joint (wrist/ankle) when it is visible in both frames,
 *       otherwise the mid joint (elbow/knee). Neither visible → no candidate.</li>
 *   <li>velocity = planar displacement of the motion joint between the frames; it must exceed
 *       {@link DetectorSettings#velocityThreshold()}.</li>
 *   <li>Extension test: the proximal→motion-joint reach must grow, and when the opponent is
 *       visible the displacement must point toward the opponent's torso centre.</li>
 * </ol>
 * Same-limb candidates within the refractory period collapse to the local velocity maximum.
 *
 * <p>Stateless and thread-safe; one instance may serve many sessions.
 */
public final class StrikeCandidateDetector {

    private static final Logger log = LoggerFactory.getLogger(StrikeCandidateDetector.class);

    private final DetectorSettings settings;

    public StrikeCandidateDetector(DetectorSettings settings) {
        this.settings = settings;
    }

    public DetectionResult detect(List<PoseFrame> frames) {
        if (frames == null || frames.isEmpty()) {
            return DetectionResult.empty();
        }

        List<PoseFrame> valid = new ArrayList<>(frames.size());
        int skipped = 0;
        double lastTimestamp = Double.NEGATIVE_INFINITY;
        for (PoseFrame frame : frames) {
            if (!isWellFormed(frame) || frame.timestampSeconds() <= lastTimestamp) {
                skipped++;
                log.debug("[Detector] Skipping malformed frame. frameIndex={}",
                    frame != null ? frame.frameIndex() : null);
                continue;
            }
            valid.add(frame);
            lastTimestamp = frame.timestampSeconds();
        }

        List<StrikeCandidate> raw = new ArrayList<>();
        for (int i = 1; i < valid.size(); i++) {
            PoseFrame previous = valid.get(i - 1);
            PoseFrame current  = valid.get(i);
            int after = i + 1 < valid.size() ? valid.get(i + 1).frameIndex() : current.frameIndex();
            FrameWindow window = new FrameWindow(previous.frameIndex(), current.frameIndex(), after);

            for (FighterLabel thrower : FighterLabel.values()) {
                PoseLandmarks before = previous.person(thrower);
                PoseLandmarks now    = current.person(thrower);
                if (before == null || now == null) {
                    continue;
                }
                PoseLandmarks opponent = current.person(thrower.opponent());
                for (Limb limb : Limb.values()) {
                    evaluate(thrower, limb, before, now, opponent, current, window).ifPresent(raw::add);
                }
            }
        }

        List<StrikeCandidate> collapsed = collapseRefractory(raw);
        log.info("[Detector] Detection complete. framesAnalyzed={} framesSkipped={} rawCandidates={} candidates={}",
            valid.size(), skipped, raw.size(), collapsed.size());
        return new DetectionResult(collapsed, valid.size(), skipped);
    }

    // ── per-limb evaluation ────────────────────────────────────────────────

    Optional<StrikeCandidate> evaluate(FighterLabel thrower, Limb limb,
                                       PoseLandmarks before, PoseLandmarks now,
                                       PoseLandmarks opponent, PoseFrame frame, FrameWindow window) {
        double minVisibility = settings.minVisibility();

        PoseJoint motionJoint;
        if (before.isVisible(limb.distal(), minVisibility) && now.isVisible(limb.distal(), minVisibility)) {
            motionJoint = limb.distal();
        } else if (before.isVisible(limb.mid(), minVisibility) && now.isVisible(limb.mid(), minVisibility)) {
            motionJoint = limb.mid();
        } else {
            return Optional.empty();
        }

        Landmark from = before.get(motionJoint);
        Landmark to   = now.get(motionJoint);
        double velocity = from.distanceTo(to);
        if (velocity <= settings.velocityThreshold()) {
            return Optional.empty();
        }

        if (!before.isVisible(limb.proximal(), minVisibility) || !now.isVisible(limb.proximal(), minVisibility)) {
            return Optional.empty();
        }
        Landmark anchorBefore = before.get(limb.proximal());
        Landmark anchorNow    = now.get(limb.proximal());
        if (anchorNow.distanceTo(to) <= anchorBefore.distanceTo(from)) {
            return Optional.empty();
        }

        Double fighterDistance = null;
        Optional<Landmark> opponentCenter = opponent != null
            ? opponent.torsoCenter(minVisibility) : Optional.empty();
        if (opponentCenter.isPresent()) {
            Landmark target = opponentCenter.get();
            double dx = to.x() - from.x();
            double dy = to.y() - from.y();
            double tx = target.x() - anchorNow.x();
            double ty = target.y() - anchorNow.y();
            if (dx * tx + dy * ty <= 0.0) {
                return Optional.empty();
            }
            fighterDistance = now.torsoCenter(minVisibility)
                .map(own -> own.distanceTo(target))
                .orElse(null);
        }

        double confidence = Math.min(velocity / settings.velocityThreshold(), 1.0);
        return Optional.of(new StrikeCandidate(thrower, limb, frame.frameIndex(), frame.timestampSeconds(),
            velocity, confidence, window, fighterDistance));
    }

    // ── refractory collapse ────────────────────────────────────────────────

    List<StrikeCandidate> collapseRefractory(List<StrikeCandidate> raw) {
        Map<FighterLabel, Map<Limb, List<StrikeCandidate>>> groups = new EnumMap<>(FighterLabel.class);
        for (StrikeCandidate candidate : raw) {
            groups.computeIfAbsent(candidate.thrower(), k -> new EnumMap<>(Limb.class))
                  .computeIfAbsent(candidate.limb(), k -> new ArrayList<>())
                  .add(candidate);
        }

        List<StrikeCandidate> result = new ArrayList<>();
        for (Map<Limb, List<StrikeCandidate>> byLimb : groups.values()) {
            for (List<StrikeCandidate> group : byLimb.values()) {
                group.sort(Comparator.comparingDouble(StrikeCandidate::timestampSeconds));
                StrikeCandidate best = group.get(0);
                StrikeCandidate last = group.get(0);
                for (int i = 1; i < group.size(); i++) {
                    StrikeCandidate next = group.get(i);
                    if (next.timestampSeconds() - last.timestampSeconds() <= settings.refractorySeconds()) {
                        if (next.velocity() > best.velocity()) {
                            best = next;
                        }
                    } else {
                        result.add(best);
                        best = next;
                    }
                    last = next;
                }
                result.add(best);
            }
        }
        result.sort(StrikeOrdering.CANDIDATES);
        return result;
    }

    private static boolean isWellFormed(PoseFrame frame) {
        if (frame == null || frame.persons() == null || frame.unrecognizedPersons() > 0) {
            return false;
        }
        if (!Double.isFinite(frame.timestampSeconds()) || frame.timestampSeconds() < 0.0) {
            return false;
        }
        return frame.persons().values().stream().allMatch(p -> p != null && p.isFinite());
    }
}

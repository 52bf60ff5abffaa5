package com.fightsight.common.combination;

import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.Limb;
import com.fightsight.common.model.StrikeCategory;
import com.fightsight.common.model.StrikeOutcome;
import com.fightsight.common.model.StrikeRecord;
import com.fightsight.common.model.TargetZone;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link CombinationDetector}.
 */
class CombinationDetectorTest {

    private static final double WINDOW = CombinationDetector.DEFAULT_WINDOW_SECONDS;

    @Nested
    @DisplayName("detect() — clustering")
    class Clustering {

        @Test
        @DisplayName("[0.0, 0.5, 1.0] from one fighter → one combination, positions 1..3")
        void threeCloseStrikes_oneCombination() {
            StrikeRecord s1 = strike(1L, FighterLabel.FIGHTER_A, 0.0);
            StrikeRecord s2 = strike(2L, FighterLabel.FIGHTER_A, 0.5);
            StrikeRecord s3 = strike(3L, FighterLabel.FIGHTER_A, 1.0);

            List<StrikeCluster> clusters = CombinationDetector.detect(List.of(s1, s2, s3), WINDOW);

            assertEquals(1, clusters.size());
            assertEquals(List.of(s1, s2, s3), clusters.get(0).members());
            assertEquals(FighterLabel.FIGHTER_A, clusters.get(0).thrower());
            assertEquals(3, clusters.get(0).strikeCount());
            assertEquals(1.0, clusters.get(0).durationSeconds(), 1e-9);
        }

        @Test
        @DisplayName("[0.0, 0.5, 3.0] → first two form a combination, third stays alone")
        void gapBreaksCluster() {
            StrikeRecord s1 = strike(1L, FighterLabel.FIGHTER_A, 0.0);
            StrikeRecord s2 = strike(2L, FighterLabel.FIGHTER_A, 0.5);
            StrikeRecord s3 = strike(3L, FighterLabel.FIGHTER_A, 3.0);

            List<StrikeCluster> clusters = CombinationDetector.detect(List.of(s1, s2, s3), WINDOW);

            assertEquals(1, clusters.size());
            assertEquals(List.of(s1, s2), clusters.get(0).members());
        }

        @Test
        @DisplayName("gap equal to the window still joins the cluster")
        void gapEqualToWindow_joins() {
            List<StrikeCluster> clusters = CombinationDetector.detect(List.of(
                strike(1L, FighterLabel.FIGHTER_A, 0.0),
                strike(2L, FighterLabel.FIGHTER_A, 2.0)), WINDOW);

            assertEquals(1, clusters.size());
            assertEquals(2, clusters.get(0).strikeCount());
        }

        @Test
        @DisplayName("gap is measured from the most recent member, so a chain can outlast the window")
        void chainedStrikes_extendCluster() {
            List<StrikeCluster> clusters = CombinationDetector.detect(List.of(
                strike(1L, FighterLabel.FIGHTER_A, 0.0),
                strike(2L, FighterLabel.FIGHTER_A, 1.5),
                strike(3L, FighterLabel.FIGHTER_A, 3.0),
                strike(4L, FighterLabel.FIGHTER_A, 4.5)), WINDOW);

            assertEquals(1, clusters.size());
            assertEquals(4, clusters.get(0).strikeCount());
        }

        @Test
        @DisplayName("an opponent's strike in between closes the open cluster")
        void opponentStrike_breaksCluster() {
            List<StrikeCluster> clusters = CombinationDetector.detect(List.of(
                strike(1L, FighterLabel.FIGHTER_A, 0.0),
                strike(2L, FighterLabel.FIGHTER_A, 0.3),
                strike(3L, FighterLabel.FIGHTER_B, 0.6),
                strike(4L, FighterLabel.FIGHTER_A, 0.9),
                strike(5L, FighterLabel.FIGHTER_B, 1.2),
                strike(6L, FighterLabel.FIGHTER_B, 1.4)), WINDOW);

            assertEquals(2, clusters.size());
            assertEquals(FighterLabel.FIGHTER_A, clusters.get(0).thrower());
            assertEquals(List.of(1L, 2L), ids(clusters.get(0)));
            assertEquals(FighterLabel.FIGHTER_B, clusters.get(1).thrower());
            assertEquals(List.of(5L, 6L), ids(clusters.get(1)));
        }

        @Test
        @DisplayName("single strikes never form a combination")
        void singleStrike_noCombination() {
            assertTrue(CombinationDetector.detect(
                List.of(strike(1L, FighterLabel.FIGHTER_A, 0.0)), WINDOW).isEmpty());
        }

        @Test
        @DisplayName("null or empty input → no combinations")
        void emptyInput() {
            assertTrue(CombinationDetector.detect(null, WINDOW).isEmpty());
            assertTrue(CombinationDetector.detect(List.of(), WINDOW).isEmpty());
        }

        @Test
        @DisplayName("non-positive window is rejected")
        void invalidWindow_rejected() {
            assertThrows(IllegalArgumentException.class,
                () -> CombinationDetector.detect(List.of(), 0.0));
            assertThrows(IllegalArgumentException.class,
                () -> CombinationDetector.detect(List.of(), Double.NaN));
        }

        @Test
        @DisplayName("landed and missed counts partition every outcome")
        void landedAndMissedCounts() {
            List<StrikeCluster> clusters = CombinationDetector.detect(List.of(
                strike(1L, FighterLabel.FIGHTER_A, 0.0, StrikeOutcome.LANDED_CLEAN),
                strike(2L, FighterLabel.FIGHTER_A, 0.4, StrikeOutcome.BLOCKED),
                strike(3L, FighterLabel.FIGHTER_A, 0.8, StrikeOutcome.PARTIALLY_LANDED),
                strike(4L, FighterLabel.FIGHTER_A, 1.2, StrikeOutcome.SLIPPED)), WINDOW);

            StrikeCluster cluster = clusters.get(0);
            assertEquals(2, cluster.landedCount());
            assertEquals(2, cluster.missedCount());
            assertEquals(cluster.strikeCount(), cluster.landedCount() + cluster.missedCount());
        }
    }

    @Nested
    @DisplayName("detect() — determinism and assignment invariants")
    class Invariants {

        @Test
        @DisplayName("shuffled input yields identical clusters")
        void shuffledInput_sameResult() {
            List<StrikeRecord> strikes = sparringRound();
            List<StrikeCluster> expected = CombinationDetector.detect(strikes, WINDOW);

            Random random = new Random(42);
            for (int i = 0; i < 20; i++) {
                List<StrikeRecord> shuffled = new ArrayList<>(strikes);
                Collections.shuffle(shuffled, random);
                assertEquals(expected, CombinationDetector.detect(shuffled, WINDOW));
            }
        }

        @Test
        @DisplayName("re-running on the same strikes is idempotent")
        void rerun_isIdempotent() {
            List<StrikeRecord> strikes = sparringRound();
            assertEquals(CombinationDetector.detect(strikes, WINDOW), CombinationDetector.detect(strikes, WINDOW));
        }

        @Test
        @DisplayName("same-timestamp strikes are ordered by frame, then fighter label")
        void tiesBrokenCanonically() {
            StrikeRecord b = new StrikeRecord(2L, FighterLabel.FIGHTER_B, 1.0, 30, Limb.LEFT_ARM,
                StrikeCategory.HAND, TargetZone.HEAD, StrikeOutcome.MISSED, null);
            StrikeRecord a = new StrikeRecord(1L, FighterLabel.FIGHTER_A, 1.0, 30, Limb.LEFT_ARM,
                StrikeCategory.HAND, TargetZone.HEAD, StrikeOutcome.MISSED, null);

            List<StrikeRecord> sorted = new ArrayList<>(List.of(b, a));
            sorted.sort(StrikeOrdering.CANONICAL);

            assertEquals(List.of(a, b), sorted);
        }

        @Test
        @DisplayName("no strike belongs to two combinations and each combination has one thrower")
        void uniqueMembershipAndSingleThrower() {
            List<StrikeCluster> clusters = CombinationDetector.detect(sparringRound(), WINDOW);

            Set<Long> seen = new HashSet<>();
            for (StrikeCluster cluster : clusters) {
                assertTrue(cluster.strikeCount() >= CombinationDetector.MIN_STRIKES);
                for (StrikeRecord member : cluster.members()) {
                    assertTrue(seen.add(member.id()), "strike " + member.id() + " assigned twice");
                    assertEquals(cluster.thrower(), member.thrower());
                }
            }
        }

        @Test
        @DisplayName("members are in non-decreasing timestamp order")
        void membersOrdered() {
            for (StrikeCluster cluster : CombinationDetector.detect(sparringRound(), WINDOW)) {
                for (int i = 1; i < cluster.members().size(); i++) {
                    assertTrue(cluster.members().get(i - 1).timestampSeconds()
                        <= cluster.members().get(i).timestampSeconds());
                }
            }
        }
    }

    // ── fixtures ───────────────────────────────────────────────────────────

    private static List<StrikeRecord> sparringRound() {
        return List.of(
            strike(1L, FighterLabel.FIGHTER_A, 0.0),
            strike(2L, FighterLabel.FIGHTER_A, 0.4),
            strike(3L, FighterLabel.FIGHTER_A, 0.9),
            strike(4L, FighterLabel.FIGHTER_B, 2.0),
            strike(5L, FighterLabel.FIGHTER_B, 2.3),
            strike(6L, FighterLabel.FIGHTER_A, 5.0),
            strike(7L, FighterLabel.FIGHTER_B, 9.0),
            strike(8L, FighterLabel.FIGHTER_B, 10.5),
            strike(9L, FighterLabel.FIGHTER_B, 12.0),
            strike(10L, FighterLabel.FIGHTER_A, 12.0));
    }

    private static List<Long> ids(StrikeCluster cluster) {
        return cluster.members().stream().map(StrikeRecord::id).toList();
    }

    static StrikeRecord strike(Long id, FighterLabel thrower, double timestamp) {
        return strike(id, thrower, timestamp, StrikeOutcome.LANDED_CLEAN);
    }

    static StrikeRecord strike(Long id, FighterLabel thrower, double timestamp, StrikeOutcome outcome) {
        return new StrikeRecord(id, thrower, timestamp, (int) Math.round(timestamp * 30),
            Limb.RIGHT_ARM, StrikeCategory.HAND, TargetZone.HEAD, outcome, null);
    }
}

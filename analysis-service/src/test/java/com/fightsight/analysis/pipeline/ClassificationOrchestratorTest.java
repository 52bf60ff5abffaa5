package com.fightsight.analysis.pipeline;

import com.fightsight.analysis.client.StrikeClassifier;
import com.fightsight.analysis.client.dto.ClassificationRequest;
import com.fightsight.analysis.client.dto.ClassificationResponse;
import com.fightsight.analysis.config.ClassificationSettings;
import com.fightsight.common.exception.FatalProviderException;
import com.fightsight.common.exception.PipelineTimeoutException;
import com.fightsight.common.exception.TransientProviderException;
import com.fightsight.common.model.FighterLabel;
import com.fightsight.common.model.StrikeCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.fightsight.analysis.pipeline.PipelineFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ClassificationOrchestratorTest {

    private static final ClassificationSettings FAST_RETRIES =
        new ClassificationSettings(4, 3, Duration.ofMillis(1), Duration.ofMillis(5));

    private final Clock clock = Clock.systemUTC();

    private ClassificationOrchestrator orchestrator(StrikeClassifier classifier, ClassificationSettings settings) {
        return new ClassificationOrchestrator(classifier, new ProviderRateLimiter("classifier", 0.0), settings, clock);
    }

    private SessionDeadline generousDeadline() {
        return SessionDeadline.startingAt(clock.instant(), Duration.ofMinutes(5), Duration.ofSeconds(5));
    }

    @Nested
    @DisplayName("classifyAll() — outcomes")
    class Outcomes {

        @Test
        @DisplayName("confirmed and false-positive verdicts are tallied and costed")
        void confirmedAndFalsePositive() {
            StrikeCandidate real  = candidate(FighterLabel.FIGHTER_A, 10, 0.33);
            StrikeCandidate ghost = candidate(FighterLabel.FIGHTER_B, 20, 0.66);
            StrikeClassifier classifier = request -> Mono.just(request.frameIndices().during() == 10
                ? landedJab(0.004)
                : ClassificationResponse.falsePositive(0.002));
            ClassificationTally tally = new ClassificationTally(2);

            StepVerifier.create(orchestrator(classifier, FAST_RETRIES)
                    .classifyAll(pendingSession(), List.of(real, ghost), generousDeadline(), tally))
                .assertNext(report -> {
                    assertEquals(1, report.confirmed().size());
                    assertSame(real, report.confirmed().get(0).candidate());
                    assertEquals(ClassificationOutcome.Status.FALSE_POSITIVE, report.outcomes().get(1).status());
                })
                .verifyComplete();

            assertEquals(1, tally.classified());
            assertEquals(1, tally.falsePositive());
            assertEquals(0, tally.failed());
            assertEquals(2, tally.calls());
            assertEquals(0.006, tally.cost(), 1e-12);
            assertTrue(tally.isBalanced());
        }

        @Test
        @DisplayName("outcomes come back in candidate order regardless of completion order")
        void orderedByTimestamp() {
            StrikeCandidate early = candidate(FighterLabel.FIGHTER_A, 10, 0.3);
            StrikeCandidate mid   = candidate(FighterLabel.FIGHTER_B, 20, 0.6);
            StrikeCandidate late  = candidate(FighterLabel.FIGHTER_A, 30, 0.9);
            StrikeClassifier classifier = request -> Mono.just(landedJab(0.001))
                .delayElement(Duration.ofMillis(60 - request.frameIndices().during() * 2L));

            StepVerifier.create(orchestrator(classifier, FAST_RETRIES)
                    .classifyAll(pendingSession(), List.of(late, early, mid), generousDeadline(),
                                 new ClassificationTally(3)))
                .assertNext(report -> assertEquals(List.of(early, mid, late),
                    report.outcomes().stream().map(ClassificationOutcome::candidate).toList()))
                .verifyComplete();
        }

        @Test
        @DisplayName("no candidates → empty report without calls")
        void noCandidates() {
            AtomicInteger calls = new AtomicInteger();
            StrikeClassifier classifier = request -> {
                calls.incrementAndGet();
                return Mono.just(landedJab(0.0));
            };
            ClassificationTally tally = new ClassificationTally(0);

            StepVerifier.create(orchestrator(classifier, FAST_RETRIES)
                    .classifyAll(pendingSession(), List.of(), generousDeadline(), tally))
                .assertNext(report -> assertTrue(report.outcomes().isEmpty()))
                .verifyComplete();
            assertEquals(0, calls.get());
            assertTrue(tally.isBalanced());
        }

        @Test
        @DisplayName("frame image URIs are built from the session's frames location")
        void frameImages() {
            ClassificationOrchestrator orchestrator = orchestrator(request -> Mono.empty(), FAST_RETRIES);

            ClassificationRequest request = orchestrator.buildRequest(pendingSession(),
                candidate(FighterLabel.FIGHTER_B, 42, 1.4));

            assertEquals(FRAMES + "/frame_000041.jpg", request.frameImages().before());
            assertEquals(FRAMES + "/frame_000042.jpg", request.frameImages().during());
            assertEquals(FRAMES + "/frame_000043.jpg", request.frameImages().after());
            assertEquals(FighterLabel.FIGHTER_A, request.receiver());
        }
    }

    @Nested
    @DisplayName("classifyAll() — errors and retries")
    class Errors {

        @Test
        @DisplayName("two transient failures then success → confirmed after three attempts")
        void transientThenSuccess() {
            AtomicInteger calls = new AtomicInteger();
            StrikeClassifier classifier = request -> calls.incrementAndGet() <= 2
                ? Mono.error(new TransientProviderException(SESSION_ID, "HTTP 503"))
                : Mono.just(landedJab(0.003));
            ClassificationTally tally = new ClassificationTally(1);

            StepVerifier.create(orchestrator(classifier, FAST_RETRIES).classifyAll(pendingSession(),
                    List.of(candidate(FighterLabel.FIGHTER_A, 5, 0.2)), generousDeadline(), tally))
                .assertNext(report -> {
                    ClassificationOutcome outcome = report.outcomes().get(0);
                    assertTrue(outcome.isConfirmed());
                    assertEquals(3, outcome.attempts());
                })
                .verifyComplete();
            assertEquals(3, tally.calls());
            assertEquals(1, tally.classified());
        }

        @Test
        @DisplayName("transient failures past the retry budget mark only that candidate failed")
        void retriesExhausted_candidateFailed() {
            StrikeCandidate flaky  = candidate(FighterLabel.FIGHTER_A, 5, 0.2);
            StrikeCandidate stable = candidate(FighterLabel.FIGHTER_B, 9, 0.3);
            StrikeClassifier classifier = request -> request.frameIndices().during() == 5
                ? Mono.error(new TransientProviderException(SESSION_ID, "HTTP 429"))
                : Mono.just(landedJab(0.002));
            ClassificationTally tally = new ClassificationTally(2);

            StepVerifier.create(orchestrator(classifier, FAST_RETRIES).classifyAll(pendingSession(),
                    List.of(flaky, stable), generousDeadline(), tally))
                .assertNext(report -> {
                    ClassificationOutcome failed = report.outcomes().get(0);
                    assertEquals(ClassificationOutcome.Status.FAILED, failed.status());
                    assertEquals(3, failed.attempts());
                    assertNotNull(failed.failureReason());
                    assertTrue(report.outcomes().get(1).isConfirmed());
                })
                .verifyComplete();
            assertEquals(1, tally.failed());
            assertEquals(1, tally.classified());
            assertEquals(4, tally.calls());
            assertTrue(tally.isBalanced());
        }

        @Test
        @DisplayName("a fatal provider error aborts the whole fan-out")
        void fatalError_propagates() {
            StrikeClassifier classifier = request -> Mono.error(
                new FatalProviderException(SESSION_ID, "classifier rejected the request with HTTP 401"));

            StepVerifier.create(orchestrator(classifier, FAST_RETRIES).classifyAll(pendingSession(),
                    List.of(candidate(FighterLabel.FIGHTER_A, 5, 0.2)), generousDeadline(),
                    new ClassificationTally(1)))
                .expectError(FatalProviderException.class)
                .verify();
        }

        @Test
        @DisplayName("fatal errors are not retried")
        void fatalError_notRetried() {
            AtomicInteger calls = new AtomicInteger();
            StrikeClassifier classifier = request -> {
                calls.incrementAndGet();
                return Mono.error(new FatalProviderException(SESSION_ID, "HTTP 402"));
            };

            StepVerifier.create(orchestrator(classifier, FAST_RETRIES).classifyAll(pendingSession(),
                    List.of(candidate(FighterLabel.FIGHTER_A, 5, 0.2)), generousDeadline(),
                    new ClassificationTally(1)))
                .expectError(FatalProviderException.class)
                .verify();
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("an expired deadline dispatches nothing and ends with a timeout")
        void expiredDeadline_timesOut() {
            AtomicInteger calls = new AtomicInteger();
            StrikeClassifier classifier = request -> {
                calls.incrementAndGet();
                return Mono.just(landedJab(0.001));
            };
            SessionDeadline expired = SessionDeadline.startingAt(
                clock.instant().minusSeconds(120), Duration.ofSeconds(60), Duration.ZERO);
            ClassificationTally tally = new ClassificationTally(2);

            StepVerifier.create(orchestrator(classifier, FAST_RETRIES).classifyAll(pendingSession(),
                    List.of(candidate(FighterLabel.FIGHTER_A, 5, 0.2), candidate(FighterLabel.FIGHTER_B, 8, 0.3)),
                    expired, tally))
                .expectError(PipelineTimeoutException.class)
                .verify();
            assertEquals(0, calls.get());
            assertEquals(2, tally.failed());
            assertTrue(tally.isBalanced());
        }

        @Test
        @DisplayName("deadline passing mid-run: the in-flight call drains, later candidates are not dispatched")
        void deadlineMidRun_drainsInFlightOnly() {
            MutableClock runClock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
            SessionDeadline deadline = SessionDeadline.startingAt(
                runClock.instant(), Duration.ofSeconds(60), Duration.ofSeconds(5));
            AtomicInteger calls = new AtomicInteger();
            StrikeClassifier classifier = request -> Mono.fromCallable(() -> {
                calls.incrementAndGet();
                runClock.advance(Duration.ofSeconds(62));
                return landedJab(0.004);
            });
            ClassificationSettings oneAtATime = new ClassificationSettings(1, 3, Duration.ofMillis(1), Duration.ofMillis(5));
            ClassificationOrchestrator orchestrator = new ClassificationOrchestrator(
                classifier, new ProviderRateLimiter("classifier", 0.0), oneAtATime, runClock);
            List<StrikeCandidate> candidates = List.of(
                candidate(FighterLabel.FIGHTER_A, 10, 0.3),
                candidate(FighterLabel.FIGHTER_A, 20, 0.6),
                candidate(FighterLabel.FIGHTER_B, 30, 0.9));
            ClassificationTally tally = new ClassificationTally(candidates.size());

            StepVerifier.create(orchestrator.classifyAll(pendingSession(), candidates, deadline, tally))
                .expectError(PipelineTimeoutException.class)
                .verify();

            assertEquals(1, calls.get());
            assertEquals(1, tally.calls());
            assertEquals(1, tally.classified());
            assertEquals(2, tally.failed());
            assertEquals(0.004, tally.cost(), 1e-12);
            assertTrue(tally.isBalanced());
        }

        @Test
        @DisplayName("an in-flight call that outlasts the drain grace is cut off and counted as failed")
        void inFlightBeyondGrace_cutOff() {
            Clock frozen = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
            SessionDeadline deadline = SessionDeadline.startingAt(
                frozen.instant(), Duration.ofMillis(1), Duration.ofMillis(50));
            StrikeClassifier hanging = request -> Mono.never();
            ClassificationOrchestrator orchestrator = new ClassificationOrchestrator(
                hanging, new ProviderRateLimiter("classifier", 0.0), FAST_RETRIES, frozen);
            ClassificationTally tally = new ClassificationTally(1);

            StepVerifier.create(orchestrator.classifyAll(pendingSession(),
                    List.of(candidate(FighterLabel.FIGHTER_A, 10, 0.3)), deadline, tally))
                .expectError(PipelineTimeoutException.class)
                .verify(Duration.ofSeconds(5));

            assertEquals(1, tally.calls());
            assertEquals(1, tally.failed());
            assertTrue(tally.isBalanced());
        }
    }

    @Nested
    @DisplayName("classifyAll() — concurrency")
    class Concurrency {

        @Test
        @DisplayName("in-flight calls never exceed maxConcurrency")
        void concurrencyCap() {
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            StrikeClassifier classifier = request -> Mono.defer(() -> {
                    peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    return Mono.just(landedJab(0.001)).delayElement(Duration.ofMillis(20));
                })
                .doFinally(signal -> inFlight.decrementAndGet());
            ClassificationSettings settings = new ClassificationSettings(2, 1, Duration.ofMillis(1), Duration.ofMillis(1));

            List<StrikeCandidate> candidates = List.of(
                candidate(FighterLabel.FIGHTER_A, 10, 0.3), candidate(FighterLabel.FIGHTER_A, 20, 0.6),
                candidate(FighterLabel.FIGHTER_A, 30, 0.9), candidate(FighterLabel.FIGHTER_B, 40, 1.2),
                candidate(FighterLabel.FIGHTER_B, 50, 1.5), candidate(FighterLabel.FIGHTER_B, 60, 1.8));

            StepVerifier.create(orchestrator(classifier, settings).classifyAll(pendingSession(), candidates,
                    generousDeadline(), new ClassificationTally(candidates.size())))
                .assertNext(report -> assertEquals(6, report.confirmed().size()))
                .verifyComplete();
            assertTrue(peak.get() <= 2, "peak in-flight was " + peak.get());
            assertTrue(peak.get() >= 1);
        }
    }
}

package com.chimera.resilience;

import com.chimera.exception.BreakerOpenException;
import com.chimera.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CircuitBreaker.
 */
class CircuitBreakerTest {

    private static final Duration RECOVERY = Duration.ofSeconds(60);

    private MutableClock clock;
    private CircuitBreaker breaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        breaker = new CircuitBreaker("test_api", 3, RECOVERY, clock);
        invocations = new AtomicInteger();
    }

    private Mono<String> failing() {
        return Mono.defer(() -> {
            invocations.incrementAndGet();
            return Mono.error(new RuntimeException("boom"));
        });
    }

    private Mono<String> succeeding() {
        return Mono.fromSupplier(() -> {
            invocations.incrementAndGet();
            return "ok";
        });
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            StepVerifier.create(breaker.call(this::failing))
                    .expectErrorMessage("boom")
                    .verify();
        }
    }

    @Test
    void testOpensAfterThresholdConsecutiveFailures() {
        fail(2);
        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
        assertEquals(2, breaker.getConsecutiveFailures());

        fail(1);
        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        assertEquals(3, breaker.getConsecutiveFailures());
    }

    @Test
    void testRejectsWithoutInvokingWhileOpen() {
        fail(3);
        int before = invocations.get();

        clock.advance(RECOVERY.minusSeconds(1));
        StepVerifier.create(breaker.call(this::succeeding))
                .expectError(BreakerOpenException.class)
                .verify();

        assertEquals(before, invocations.get());
        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
    }

    @Test
    void testSuccessResetsFailureCountWhileClosed() {
        fail(2);
        StepVerifier.create(breaker.call(this::succeeding)).expectNext("ok").verifyComplete();
        assertEquals(0, breaker.getConsecutiveFailures());

        fail(2);
        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    void testTrialAtRecoveryDeadlineClosesOnSuccess() {
        fail(3);
        clock.advance(RECOVERY);

        StepVerifier.create(breaker.call(this::succeeding)).expectNext("ok").verifyComplete();

        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
        assertEquals(0, breaker.getConsecutiveFailures());
    }

    @Test
    void testTrialFailureReopensWithFreshTimestamp() {
        fail(3);
        clock.advance(RECOVERY.plusSeconds(5));
        Instant trialTime = clock.instant();

        fail(1);

        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        assertEquals(3, breaker.getConsecutiveFailures());
        assertEquals(trialTime, breaker.getLastTransition());

        // the recovery window restarts from the failed trial
        clock.advance(RECOVERY.minusSeconds(1));
        StepVerifier.create(breaker.call(this::succeeding))
                .expectError(BreakerOpenException.class)
                .verify();
    }

    @Test
    void testHalfOpenAdmitsSingleTrial() {
        fail(3);
        clock.advance(RECOVERY);

        Sinks.One<String> trialResult = Sinks.one();
        AtomicInteger trialInvocations = new AtomicInteger();

        StepVerifier trial = StepVerifier.create(breaker.call(() -> {
                    trialInvocations.incrementAndGet();
                    return trialResult.asMono();
                }))
                .expectNext("recovered")
                .expectComplete()
                .verifyLater();

        assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.getState());

        StepVerifier.create(breaker.call(this::succeeding))
                .expectError(BreakerOpenException.class)
                .verify();

        trialResult.tryEmitValue("recovered");
        trial.verify(Duration.ofSeconds(1));

        assertEquals(1, trialInvocations.get());
        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    void testCancelledTrialReopens() {
        fail(3);
        clock.advance(RECOVERY);

        StepVerifier.create(breaker.call(Mono::never))
                .thenCancel()
                .verify();

        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
    }

    @Test
    void testCancelledClosedCallsAreNotFailures() {
        for (int i = 0; i < 3; i++) {
            StepVerifier.create(breaker.call(Mono::never))
                    .thenCancel()
                    .verify();
        }

        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
        assertEquals(0, breaker.getConsecutiveFailures());
        StepVerifier.create(breaker.call(() -> Mono.just("healthy")))
                .expectNext("healthy")
                .verifyComplete();
    }

    @Test
    void testCancelledCallDoesNotResetFailureCount() {
        fail(2);

        StepVerifier.create(breaker.call(Mono::never))
                .thenCancel()
                .verify();

        assertEquals(2, breaker.getConsecutiveFailures());
        assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    }

    @Test
    void testThrowingSupplierCountsAsFailure() {
        for (int i = 0; i < 3; i++) {
            StepVerifier.create(breaker.<String>call(() -> {
                        throw new IllegalStateException("cannot build request");
                    }))
                    .expectError(IllegalStateException.class)
                    .verify();
        }
        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
    }

    @Test
    void testConcurrentFailuresAreNotLost() throws Exception {
        CircuitBreaker wide = new CircuitBreaker("wide_api", 1_000, RECOVERY, clock);
        int threads = 8;
        int callsPerThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < callsPerThread; i++) {
                        wide.call(this::failing).onErrorResume(e -> Mono.empty()).block();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(threads * callsPerThread, wide.getConsecutiveFailures());
        assertEquals(CircuitBreaker.State.CLOSED, wide.getState());
    }

    @Test
    void testRejectsInvalidThreshold() {
        assertThrows(IllegalArgumentException.class,
                () -> new CircuitBreaker("bad", 0, RECOVERY, clock));
    }
}

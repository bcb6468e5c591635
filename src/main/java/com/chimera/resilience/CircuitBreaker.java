package com.chimera.resilience;

import com.chimera.exception.BreakerOpenException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Circuit breaker guarding calls to a single provider endpoint.
 * <p>
 * One instance is shared by every concurrent request. All state reads and transitions happen
 * under {@link #lock}, so at most one half-open trial is admitted and no failure is lost.
 * Every error signalled by the guarded operation counts as a failure.
 */
@Slf4j
public class CircuitBreaker {

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private enum Admission {
        REJECTED,
        NORMAL,
        TRIAL
    }

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private final Object lock = new Object();

    private State state = State.CLOSED;
    private int consecutiveFailures = 0;
    private Instant lastTransition;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must not be negative");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
        this.lastTransition = clock.instant();
    }

    /**
     * Run the operation through the breaker. The supplier is not invoked at all when the
     * breaker rejects the call; the returned Mono then fails with {@link BreakerOpenException}.
     */
    public <T> Mono<T> call(Supplier<? extends Mono<T>> operation) {
        return Mono.defer(() -> {
            Admission admission = acquire();
            if (admission == Admission.REJECTED) {
                return Mono.error(new BreakerOpenException(name, remainingOpenTime()));
            }

            Mono<T> guarded;
            try {
                guarded = operation.get();
            } catch (RuntimeException e) {
                onFailure(admission, e);
                return Mono.error(e);
            }

            AtomicBoolean settled = new AtomicBoolean(false);
            return guarded
                    .doOnSuccess(value -> {
                        if (settled.compareAndSet(false, true)) {
                            onSuccess(admission);
                        }
                    })
                    .doOnError(error -> {
                        if (settled.compareAndSet(false, true)) {
                            onFailure(admission, error);
                        }
                    })
                    .doOnCancel(() -> {
                        // only an abandoned trial is a failure, it would otherwise hold HALF_OPEN forever
                        if (settled.compareAndSet(false, true) && admission == Admission.TRIAL) {
                            onFailure(admission, new IllegalStateException("trial call cancelled"));
                        }
                    });
        });
    }

    private Admission acquire() {
        synchronized (lock) {
            switch (state) {
                case CLOSED:
                    return Admission.NORMAL;
                case OPEN:
                    Instant now = clock.instant();
                    if (!now.isBefore(lastTransition.plus(recoveryTimeout))) {
                        transitionTo(State.HALF_OPEN, now);
                        log.info("Circuit breaker '{}' admitting trial call", name);
                        return Admission.TRIAL;
                    }
                    return Admission.REJECTED;
                case HALF_OPEN:
                default:
                    // the single trial is already in flight
                    return Admission.REJECTED;
            }
        }
    }

    private void onSuccess(Admission admission) {
        synchronized (lock) {
            if (admission == Admission.TRIAL) {
                consecutiveFailures = 0;
                transitionTo(State.CLOSED, clock.instant());
                log.info("Circuit breaker '{}' closed after successful trial", name);
            } else if (state == State.CLOSED) {
                consecutiveFailures = 0;
            }
        }
    }

    private void onFailure(Admission admission, Throwable error) {
        synchronized (lock) {
            Instant now = clock.instant();
            if (admission == Admission.TRIAL) {
                transitionTo(State.OPEN, now);
                log.warn("Circuit breaker '{}' reopened, trial call failed: {}", name, error.toString());
                return;
            }
            if (state != State.CLOSED) {
                // late failure of a call admitted before the breaker opened
                log.debug("Circuit breaker '{}' ignoring failure while {}: {}", name, state, error.toString());
                return;
            }
            consecutiveFailures++;
            if (consecutiveFailures >= failureThreshold) {
                transitionTo(State.OPEN, now);
                log.warn("Circuit breaker '{}' opened after {} consecutive failures, last: {}",
                        name, consecutiveFailures, error.toString());
            } else {
                log.debug("Circuit breaker '{}' failure {}/{}: {}",
                        name, consecutiveFailures, failureThreshold, error.toString());
            }
        }
    }

    private void transitionTo(State next, Instant at) {
        state = next;
        lastTransition = at;
    }

    private Duration remainingOpenTime() {
        synchronized (lock) {
            if (state != State.OPEN) {
                return Duration.ZERO;
            }
            Duration remaining = Duration.between(clock.instant(), lastTransition.plus(recoveryTimeout));
            return remaining.isNegative() ? Duration.ZERO : remaining;
        }
    }

    public String getName() {
        return name;
    }

    public State getState() {
        synchronized (lock) {
            return state;
        }
    }

    public int getConsecutiveFailures() {
        synchronized (lock) {
            return consecutiveFailures;
        }
    }

    public Instant getLastTransition() {
        synchronized (lock) {
            return lastTransition;
        }
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }
}

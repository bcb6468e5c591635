package com.chimera.exception;

import java.time.Duration;

/**
 * Raised without contacting the provider while its circuit breaker rejects calls.
 */
public class BreakerOpenException extends GenerationException {

    private final String breakerName;
    private final Duration retryAfter;

    public BreakerOpenException(String breakerName, Duration retryAfter) {
        super("Circuit breaker '" + breakerName + "' is open, provider unavailable (retry in "
                + Math.max(0, retryAfter.toSeconds()) + "s)");
        this.breakerName = breakerName;
        this.retryAfter = retryAfter;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}

package com.chimera.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Process-lifetime generation statistics for the admin endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationStatistics {

    /**
     * Provider invocations drained so far, fallback calls included.
     */
    private long generationCount;

    /**
     * Structured responses that could not be parsed.
     */
    private long jsonFailures;

    /**
     * Mean of per-call cache hit rates over all generations (0.0-1.0).
     */
    private double averageCacheHitRate;

    /**
     * Schema validation successes by mode id.
     */
    private Map<String, Long> modeValidationSuccess;

    /**
     * Schema validation failures by mode id.
     */
    private Map<String, Long> modeValidationFailures;

    private BreakerStatus breaker;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BreakerStatus {
        private String name;
        private String state;
        private int consecutiveFailures;
        private int failureThreshold;
        private long recoveryTimeoutSeconds;
    }
}

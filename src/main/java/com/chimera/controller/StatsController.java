package com.chimera.controller;

import com.chimera.model.dto.GenerationStatistics;
import com.chimera.resilience.CircuitBreaker;
import com.chimera.service.GenerationMetrics;
import com.chimera.service.GenerationOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of generation counters and breaker state.
 */
@RestController
@RequestMapping("/v1/admin")
public class StatsController {

    private final GenerationOrchestrator orchestrator;
    private final CircuitBreaker circuitBreaker;

    public StatsController(GenerationOrchestrator orchestrator, CircuitBreaker circuitBreaker) {
        this.orchestrator = orchestrator;
        this.circuitBreaker = circuitBreaker;
    }

    @GetMapping("/stats")
    public ResponseEntity<GenerationStatistics> getStats() {
        GenerationMetrics metrics = orchestrator.getMetrics();

        GenerationStatistics.BreakerStatus breaker = GenerationStatistics.BreakerStatus.builder()
                .name(circuitBreaker.getName())
                .state(circuitBreaker.getState().name())
                .consecutiveFailures(circuitBreaker.getConsecutiveFailures())
                .failureThreshold(circuitBreaker.getFailureThreshold())
                .recoveryTimeoutSeconds(circuitBreaker.getRecoveryTimeout().toSeconds())
                .build();

        return ResponseEntity.ok(GenerationStatistics.builder()
                .generationCount(metrics.getGenerationCount())
                .jsonFailures(metrics.getJsonFailures())
                .averageCacheHitRate(metrics.getAverageCacheHitRate())
                .modeValidationSuccess(metrics.validationSuccessesByMode())
                .modeValidationFailures(metrics.validationFailuresByMode())
                .breaker(breaker)
                .build());
    }
}

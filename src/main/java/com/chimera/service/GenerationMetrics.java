package com.chimera.service;

import com.chimera.model.Mode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Counters owned by one {@link GenerationOrchestrator}. Safe for concurrent updates.
 */
public class GenerationMetrics {

    private final AtomicLong generationCount = new AtomicLong();
    private final DoubleAdder cacheHitRateSum = new DoubleAdder();
    private final AtomicLong jsonFailures = new AtomicLong();
    private final Map<Mode, AtomicLong> modeSuccess;
    private final Map<Mode, AtomicLong> modeFailure;

    public GenerationMetrics() {
        Map<Mode, AtomicLong> success = new EnumMap<>(Mode.class);
        Map<Mode, AtomicLong> failure = new EnumMap<>(Mode.class);
        for (Mode mode : Mode.values()) {
            success.put(mode, new AtomicLong());
            failure.put(mode, new AtomicLong());
        }
        // key sets are fixed, only the counters change
        this.modeSuccess = Collections.unmodifiableMap(success);
        this.modeFailure = Collections.unmodifiableMap(failure);
    }

    /**
     * @return the generation count including this one
     */
    public long recordGeneration() {
        return generationCount.incrementAndGet();
    }

    public void recordCacheHitRate(double rate) {
        cacheHitRateSum.add(rate);
    }

    public long recordJsonFailure() {
        return jsonFailures.incrementAndGet();
    }

    public void recordValidation(Mode mode, boolean valid) {
        (valid ? modeSuccess : modeFailure).get(mode).incrementAndGet();
    }

    public long getGenerationCount() {
        return generationCount.get();
    }

    public long getJsonFailures() {
        return jsonFailures.get();
    }

    /**
     * Sum of hit rates divided by all generations, including those without cache data.
     */
    public double getAverageCacheHitRate() {
        long count = generationCount.get();
        return count == 0 ? 0.0 : cacheHitRateSum.sum() / count;
    }

    public long getValidationSuccesses(Mode mode) {
        return modeSuccess.get(mode).get();
    }

    public long getValidationFailures(Mode mode) {
        return modeFailure.get(mode).get();
    }

    public Map<String, Long> validationSuccessesByMode() {
        return snapshot(modeSuccess);
    }

    public Map<String, Long> validationFailuresByMode() {
        return snapshot(modeFailure);
    }

    public long totalValidationSuccesses() {
        return modeSuccess.values().stream().mapToLong(AtomicLong::get).sum();
    }

    private static Map<String, Long> snapshot(Map<Mode, AtomicLong> counters) {
        Map<String, Long> snapshot = new LinkedHashMap<>();
        counters.forEach((mode, counter) -> snapshot.put(mode.getId(), counter.get()));
        return snapshot;
    }
}

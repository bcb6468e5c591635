package com.chimera.model;

import lombok.Value;

/**
 * Aggregated outcome of one drained provider stream.
 */
@Value
public class InvocationResult {
    String text;
    long cacheHitTokens;
    long cacheMissTokens;

    public long totalPromptTokens() {
        return cacheHitTokens + cacheMissTokens;
    }
}

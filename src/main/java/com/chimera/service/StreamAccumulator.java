package com.chimera.service;

import com.chimera.model.ChatCompletionChunk;
import com.chimera.model.InvocationResult;
import com.chimera.model.Usage;

/**
 * Folds a chunk stream into text and cache telemetry.
 * <p>
 * Text fragments are appended in arrival order. Usage is cumulative on the provider side, so
 * the last chunk carrying usage replaces the counts instead of adding to them.
 * Not thread-safe: one instance per drained stream.
 */
public class StreamAccumulator {

    private final StringBuilder text = new StringBuilder();
    private long cacheHitTokens = 0;
    private long cacheMissTokens = 0;
    private int chunks = 0;

    public void accept(ChatCompletionChunk chunk) {
        chunks++;

        String content = chunk.firstDeltaContent();
        if (content != null && !content.isEmpty()) {
            text.append(content);
        }

        Usage usage = chunk.getUsage();
        if (usage != null) {
            cacheHitTokens = valueOf(usage.getPromptCacheHitTokens());
            cacheMissTokens = valueOf(usage.getPromptCacheMissTokens());
        }
    }

    public int getChunkCount() {
        return chunks;
    }

    public InvocationResult toResult() {
        return new InvocationResult(text.toString(), cacheHitTokens, cacheMissTokens);
    }

    private static long valueOf(Integer tokens) {
        return tokens != null ? tokens : 0L;
    }
}

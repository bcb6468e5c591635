package com.chimera.service;

import com.chimera.model.ChatCompletionChunk;
import com.chimera.model.InvocationResult;
import com.chimera.model.Usage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.chimera.support.ScriptedChatProvider.textChunk;
import static com.chimera.support.ScriptedChatProvider.usageChunk;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StreamAccumulator.
 */
class StreamAccumulatorTest {

    @Test
    void testConcatenatesFragmentsInArrivalOrder() {
        StreamAccumulator accumulator = new StreamAccumulator();
        accumulator.accept(textChunk("{\"resp"));
        accumulator.accept(textChunk("onse\": "));
        accumulator.accept(textChunk("\"hi\"}"));

        assertEquals("{\"response\": \"hi\"}", accumulator.toResult().getText());
        assertEquals(3, accumulator.getChunkCount());
    }

    @Test
    void testSkipsChunksWithoutContent() {
        StreamAccumulator accumulator = new StreamAccumulator();
        accumulator.accept(ChatCompletionChunk.builder().build());
        accumulator.accept(ChatCompletionChunk.builder().choices(List.of()).build());
        accumulator.accept(textChunk(null));
        accumulator.accept(textChunk("a"));

        assertEquals("a", accumulator.toResult().getText());
    }

    @Test
    void testLastUsageOverwritesPreviousCounts() {
        StreamAccumulator accumulator = new StreamAccumulator();
        accumulator.accept(usageChunk(10, 90));
        accumulator.accept(textChunk("x"));
        accumulator.accept(usageChunk(64, 36));

        InvocationResult result = accumulator.toResult();
        assertEquals(64, result.getCacheHitTokens());
        assertEquals(36, result.getCacheMissTokens());
        assertEquals(100, result.totalPromptTokens());
    }

    @Test
    void testMissingUsageFieldsReadAsZero() {
        StreamAccumulator accumulator = new StreamAccumulator();
        accumulator.accept(usageChunk(10, 90));
        accumulator.accept(ChatCompletionChunk.builder()
                .usage(Usage.builder().promptTokens(100).build())
                .build());

        InvocationResult result = accumulator.toResult();
        assertEquals(0, result.getCacheHitTokens());
        assertEquals(0, result.getCacheMissTokens());
    }

    @Test
    void testEmptyStream() {
        InvocationResult result = new StreamAccumulator().toResult();

        assertEquals("", result.getText());
        assertEquals(0, result.totalPromptTokens());
    }
}

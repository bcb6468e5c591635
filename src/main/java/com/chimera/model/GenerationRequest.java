package com.chimera.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single generation request as seen by the orchestrator.
 */
@Value
@Builder
public class GenerationRequest {

    @NonNull
    String userId;

    @NonNull
    String text;

    @NonNull
    @Builder.Default
    Mode mode = Mode.BASE;

    @Builder.Default
    boolean includePrompt = true;
}

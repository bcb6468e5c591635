package com.chimera.provider;

import com.chimera.model.ChatCompletionChunk;
import com.chimera.model.ChatCompletionRequest;
import reactor.core.publisher.Flux;

/**
 * Interface for streaming chat completion providers.
 * Implementations handle provider-specific authentication and wire decoding.
 */
public interface ChatProvider {

    /**
     * Get provider name (e.g., "deepseek").
     *
     * @return provider name
     */
    String getName();

    /**
     * Stream a chat completion.
     * <p>
     * The returned Flux is cold: every subscription issues a new HTTP request. Chunks are
     * emitted in arrival order and the Flux completes when the provider signals the end of the
     * stream. Failures are signalled as {@link com.chimera.exception.ProviderException}.
     *
     * @param request OpenAI-compatible request with {@code stream=true}
     * @return finite stream of chunks
     */
    Flux<ChatCompletionChunk> stream(ChatCompletionRequest request);

    /**
     * Check if provider is enabled and configured.
     *
     * @return true if ready to use
     */
    boolean isEnabled();
}

package com.chimera.provider;

import com.chimera.config.ChimeraProperties;
import com.chimera.exception.ProviderException;
import com.chimera.model.ChatCompletionChunk;
import com.chimera.model.ChatCompletionRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Streaming provider for OpenAI-compatible chat completion endpoints (DeepSeek, OpenAI).
 * Reads the SSE body until the {@code [DONE]} sentinel.
 */
@Slf4j
@Component
public class OpenAICompatibleProvider extends AbstractChatProvider {

    static final String DONE_SENTINEL = "[DONE]";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final ObjectMapper objectMapper;

    public OpenAICompatibleProvider(WebClient webClient, ChimeraProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties);
        this.objectMapper = objectMapper;
        if (!isEnabled()) {
            log.warn("No API key configured for provider {}, generation calls will fail", getName());
        } else {
            log.info("Provider {} initialized: baseUrl={}, model={}", getName(), config.getBaseUrl(), config.getModel());
        }
    }

    @Override
    public Flux<ChatCompletionChunk> stream(ChatCompletionRequest request) {
        return Flux.defer(() -> {
            if (!isEnabled()) {
                return Flux.error(new ProviderException("Provider " + getName() + " has no API key configured", null));
            }

            log.debug("Streaming request to {}: model={}, messages={}, json={}",
                    getName(), request.getModel(), request.getMessages().size(), request.getResponseFormat() != null);

            String endpoint = config.getBaseUrl() + "/chat/completions";

            return webClient.post()
                    .uri(endpoint)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToFlux(SSE_TYPE)
                    .map(event -> event.data() != null ? event.data().trim() : "")
                    .filter(data -> !data.isEmpty())
                    .takeWhile(data -> !DONE_SENTINEL.equals(data))
                    .concatMap(this::decodeChunk);
        }).onErrorMap(this::toProviderException);
    }

    private Mono<ChatCompletionChunk> decodeChunk(String data) {
        try {
            return Mono.just(objectMapper.readValue(data, ChatCompletionChunk.class));
        } catch (JsonProcessingException e) {
            return Mono.error(new ProviderException(
                    "Undecodable chunk from " + getName() + ": " + abbreviate(data), e));
        }
    }
}

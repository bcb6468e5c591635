package com.chimera.service;

import com.chimera.config.ChimeraProperties;
import com.chimera.model.ChatCompletionRequest;
import com.chimera.model.InvocationResult;
import com.chimera.model.Message;
import com.chimera.model.Mode;
import com.chimera.model.ModeParameters;
import com.chimera.model.PromptPhase;
import com.chimera.provider.ChatProvider;
import com.chimera.resilience.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Issues one streaming completion call through the circuit breaker and drains it.
 */
@Slf4j
@Service
public class GenerationInvoker {

    private final ChatProvider provider;
    private final CircuitBreaker circuitBreaker;
    private final ModeParameterTable parameterTable;
    private final ChimeraProperties properties;

    public GenerationInvoker(ChatProvider provider,
                             CircuitBreaker circuitBreaker,
                             ModeParameterTable parameterTable,
                             ChimeraProperties properties) {
        this.provider = provider;
        this.circuitBreaker = circuitBreaker;
        this.parameterTable = parameterTable;
        this.properties = properties;
    }

    /**
     * Stream a completion for the messages and aggregate it.
     * Each subscription performs a fresh provider call; errors are not retried here.
     */
    public Mono<InvocationResult> invoke(List<Message> messages, Mode mode, PromptPhase phase) {
        ModeParameters parameters = parameterTable.resolve(mode);

        if (properties.getTelemetry().isDebugModeSelection()) {
            log.debug("Using generation params for mode '{}': temp={}, max_tokens={}",
                    mode, parameters.getTemperature(), parameters.getMaxTokens());
        }

        ChatCompletionRequest request = buildRequest(messages, parameters, phase);

        return circuitBreaker.call(() -> provider.stream(request)
                .collect(StreamAccumulator::new, StreamAccumulator::accept)
                .doOnNext(accumulator -> log.debug("Drained {} chunks from {}",
                        accumulator.getChunkCount(), provider.getName()))
                .map(StreamAccumulator::toResult));
    }

    ChatCompletionRequest buildRequest(List<Message> messages, ModeParameters parameters, PromptPhase phase) {
        ChimeraProperties.ProviderConfig providerConfig = properties.getProvider();

        ChatCompletionRequest.ChatCompletionRequestBuilder builder = ChatCompletionRequest.builder()
                .model(providerConfig.getModel())
                .messages(List.copyOf(messages))
                .temperature(parameters.getTemperature())
                .topP(parameters.getTopP())
                .maxTokens(parameters.getMaxTokens())
                .frequencyPenalty(parameters.getFrequencyPenalty())
                .presencePenalty(parameters.getPresencePenalty())
                .stream(true);

        if (providerConfig.isIncludeUsage()) {
            builder.streamOptions(new ChatCompletionRequest.StreamOptions(true));
        }

        if (phase == PromptPhase.STRUCTURED) {
            builder.responseFormat(ChatCompletionRequest.ResponseFormat.jsonObject());
        }

        return builder.build();
    }
}

package com.chimera.service;

import com.chimera.config.ChimeraProperties;
import com.chimera.event.EventEmitter;
import com.chimera.event.EventTypes;
import com.chimera.exception.StructuredParseException;
import com.chimera.model.GenerationRequest;
import com.chimera.model.InvocationResult;
import com.chimera.model.Message;
import com.chimera.model.Mode;
import com.chimera.model.ModeParameters;
import com.chimera.model.PromptPhase;
import com.chimera.model.StructuredPayload;
import com.chimera.model.ValidationOutcome;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs the structured-first generation protocol.
 * <p>
 * The structured attempt asks for a JSON object. When it cannot be parsed, one plain-text
 * fallback call is made (if enabled) and its text is returned as is. Breaker and provider
 * errors are not retried. Schema validation is advisory and only drives events and counters.
 */
@Slf4j
@Service
public class GenerationOrchestrator {

    private static final int LOGGED_VALIDATION_ERRORS = 3;

    private final PromptComposer promptComposer;
    private final GenerationInvoker invoker;
    private final StructuredExtractor extractor;
    private final SchemaValidator schemaValidator;
    private final EventEmitter eventEmitter;
    private final ModeParameterTable parameterTable;
    private final ChimeraProperties properties;
    private final GenerationMetrics metrics = new GenerationMetrics();

    public GenerationOrchestrator(PromptComposer promptComposer,
                                  GenerationInvoker invoker,
                                  StructuredExtractor extractor,
                                  SchemaValidator schemaValidator,
                                  EventEmitter eventEmitter,
                                  ModeParameterTable parameterTable,
                                  ChimeraProperties properties) {
        this.promptComposer = promptComposer;
        this.invoker = invoker;
        this.extractor = extractor;
        this.schemaValidator = schemaValidator;
        this.eventEmitter = eventEmitter;
        this.parameterTable = parameterTable;
        this.properties = properties;
    }

    public Mono<String> generate(GenerationRequest request) {
        return Mono.defer(() -> {
            boolean structured = properties.getGeneration().isJsonModeEnabled();
            PromptPhase phase = structured ? PromptPhase.STRUCTURED : PromptPhase.FALLBACK;

            log.info("Generating response for user {} in mode: {}", request.getUserId(), request.getMode());

            List<Message> messages = promptComposer.compose(
                    request.getText(), request.isIncludePrompt(), request.getMode(), phase);

            return invoke(messages, request.getMode(), phase)
                    .flatMap(result -> structured
                            ? completeStructured(request, result)
                            : Mono.just(completePlain(request, result.getText())));
        });
    }

    private Mono<String> completeStructured(GenerationRequest request, InvocationResult result) {
        StructuredPayload payload;
        try {
            payload = extractor.extract(result.getText());
        } catch (StructuredParseException e) {
            return recoverFromParseFailure(request, result, e);
        }

        if (properties.getValidation().isLogFailures()) {
            validateAdvisory(request, payload);
        }

        String response = payload.response();
        emitParametersUsed(request, response);
        return Mono.just(response);
    }

    private String completePlain(GenerationRequest request, String text) {
        emitParametersUsed(request, text);
        return text;
    }

    private Mono<String> recoverFromParseFailure(GenerationRequest request,
                                                 InvocationResult result,
                                                 StructuredParseException error) {
        log.error("Failed to parse JSON for user {}: {}", request.getUserId(), error.getMessage());
        metrics.recordJsonFailure();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", request.getUserId());
        data.put("error", error.getMessage());
        eventEmitter.emit(EventTypes.userStream(request.getUserId()), EventTypes.JSON_MODE_FAILURE, data);

        if (!properties.getGeneration().isJsonFallbackEnabled()) {
            log.warn("JSON parse failed for user {}, fallback disabled, returning raw text", request.getUserId());
            return Mono.just(result.getText());
        }

        log.warn("JSON parse failed for user {}, using fallback", request.getUserId());
        List<Message> fallbackMessages = promptComposer.compose(
                request.getText(), request.isIncludePrompt(), request.getMode(), PromptPhase.FALLBACK);
        return invoke(fallbackMessages, request.getMode(), PromptPhase.FALLBACK)
                .map(InvocationResult::getText);
    }

    private void validateAdvisory(GenerationRequest request, StructuredPayload payload) {
        Mode mode = request.getMode();
        try {
            ValidationOutcome outcome = schemaValidator.validate(payload, mode);
            metrics.recordValidation(mode, outcome.isValid());

            if (!outcome.isValid()) {
                List<String> errors = outcome.describeErrors();
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("user_id", request.getUserId());
                data.put("mode", mode.getId());
                data.put("errors", errors);
                data.put("response_fields", List.copyOf(payload.fieldNames()));
                eventEmitter.emit(EventTypes.validationStream(request.getUserId()),
                        EventTypes.JSON_VALIDATION_FAILED, data);

                log.warn("JSON validation failed for user {}: {}", request.getUserId(),
                        String.join(", ", errors.subList(0, Math.min(LOGGED_VALIDATION_ERRORS, errors.size()))));
            }
        } catch (RuntimeException e) {
            log.warn("Schema validation error for user {} ignored", request.getUserId(), e);
        }
    }

    private void emitParametersUsed(GenerationRequest request, String responseText) {
        ChimeraProperties.TelemetryConfig telemetry = properties.getTelemetry();
        if (!telemetry.isLogParametersUsage()) {
            return;
        }
        ModeParameters used = parameterTable.resolve(request.getMode());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", request.getUserId());
        data.put("mode", request.getMode().getId());
        data.put("temperature", used.getTemperature());
        data.put("top_p", used.getTopP());
        data.put("max_tokens", used.getMaxTokens());
        data.put("frequency_penalty", used.getFrequencyPenalty());
        data.put("presence_penalty", used.getPresencePenalty());
        data.put("response_length", telemetry.isLogResponseLength() ? responseText.length() : null);
        eventEmitter.emit(EventTypes.generationStream(request.getUserId()),
                EventTypes.GENERATION_PARAMETERS_USED, data);
    }

    private Mono<InvocationResult> invoke(List<Message> messages, Mode mode, PromptPhase phase) {
        return invoker.invoke(messages, mode, phase)
                .doOnNext(this::recordCacheMetrics);
    }

    private void recordCacheMetrics(InvocationResult result) {
        long generation = metrics.recordGeneration();

        long total = result.totalPromptTokens();
        if (total <= 0) {
            return;
        }

        double hitRate = (double) result.getCacheHitTokens() / total;
        metrics.recordCacheHitRate(hitRate);

        int interval = Math.max(1, properties.getTelemetry().getCacheHitLogInterval());
        if (generation % interval == 0) {
            log.info("Cache metrics - Generations: {}, Avg hit rate: {}, Last hit rate: {}",
                    generation, percent(metrics.getAverageCacheHitRate()), percent(hitRate));
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("prompt_cache_hit_tokens", result.getCacheHitTokens());
        data.put("prompt_cache_miss_tokens", result.getCacheMissTokens());
        data.put("cache_hit_rate", hitRate);
        eventEmitter.emit(EventTypes.METRICS_STREAM, EventTypes.CACHE_HIT_METRIC, data);
    }

    static String percent(double rate) {
        return String.format(Locale.ROOT, "%.2f%%", rate * 100);
    }

    public GenerationMetrics getMetrics() {
        return metrics;
    }

    @PreDestroy
    public void logSummary() {
        log.info("Generation summary: generated {} responses, JSON failures: {}",
                metrics.getGenerationCount(), metrics.getJsonFailures());
        if (metrics.totalValidationSuccesses() > 0) {
            log.info("Mode validation success: {}", metrics.validationSuccessesByMode());
            log.info("Mode validation failures: {}", metrics.validationFailuresByMode());
        }
    }
}

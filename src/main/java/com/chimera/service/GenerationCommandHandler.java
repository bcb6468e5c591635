package com.chimera.service;

import com.chimera.config.ChimeraProperties;
import com.chimera.messaging.BotResponse;
import com.chimera.messaging.ErrorMessage;
import com.chimera.messaging.GenerateResponse;
import com.chimera.messaging.OutboundMessage;
import com.chimera.messaging.OutboundMessenger;
import com.chimera.model.GenerationRequest;
import com.chimera.model.Mode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Entry point for {@link GenerateResponse} commands.
 * Every command ends with exactly one reply to the transport: the generated text or an error.
 */
@Slf4j
@Service
public class GenerationCommandHandler {

    private final GenerationOrchestrator orchestrator;
    private final OutboundMessenger messenger;
    private final ChimeraProperties properties;
    private final Clock clock;

    public GenerationCommandHandler(GenerationOrchestrator orchestrator,
                                    OutboundMessenger messenger,
                                    ChimeraProperties properties,
                                    Clock clock) {
        this.orchestrator = orchestrator;
        this.messenger = messenger;
        this.properties = properties;
        this.clock = clock;
    }

    public Mono<OutboundMessage> handle(GenerateResponse command) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            String userId = command.getUserId();
            log.info("Generating response for user {}", userId);

            return orchestrator.generate(toRequest(command))
                    .<OutboundMessage>map(text -> {
                        log.info("Generated response for user {}: {}", userId, preview(text));
                        return BotResponse.builder()
                                .userId(userId)
                                .chatId(command.getChatId())
                                .text(text)
                                .generatedAt(clock.instant())
                                .build();
                    })
                    .onErrorResume(error -> {
                        log.error("Generation failed for user {}: {}", userId, error.getMessage());
                        return Mono.just(ErrorMessage.builder()
                                .userId(userId)
                                .chatId(command.getChatId())
                                .error(describe(error))
                                .errorType(ErrorMessage.GENERATION_ERROR)
                                .build());
                    })
                    .doOnNext(this::deliver)
                    .doFinally(signal -> log.debug("Handled command for user {} in {} ms ({})",
                            userId, (System.nanoTime() - started) / 1_000_000, signal));
        });
    }

    private void deliver(OutboundMessage reply) {
        String recipient = properties.getGeneration().getReplyTo();
        try {
            messenger.sendMessage(recipient, reply);
        } catch (RuntimeException e) {
            log.error("Failed to deliver reply for user {} to {}: {}", reply.getUserId(), recipient, e.toString());
        }
    }

    GenerationRequest toRequest(GenerateResponse command) {
        if (command.getMode() != null && !Mode.isKnown(command.getMode())) {
            log.warn("Unknown mode: {}, falling back to base", command.getMode());
        }
        return GenerationRequest.builder()
                .userId(command.getUserId())
                .text(command.getText())
                .mode(Mode.resolve(command.getMode()))
                .includePrompt(command.getIncludePrompt() == null || command.getIncludePrompt())
                .build();
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static String preview(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}

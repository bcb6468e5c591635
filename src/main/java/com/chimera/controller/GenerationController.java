package com.chimera.controller;

import com.chimera.messaging.GenerateResponse;
import com.chimera.messaging.OutboundMessage;
import com.chimera.service.GenerationCommandHandler;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * HTTP entry point for generation commands.
 * The reply is also routed to the transport, the body echoes it to the caller.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class GenerationController {

    private final GenerationCommandHandler commandHandler;

    public GenerationController(GenerationCommandHandler commandHandler) {
        this.commandHandler = commandHandler;
    }

    @PostMapping(value = "/generations",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<OutboundMessage> generate(@Valid @RequestBody GenerateResponse command) {
        log.info("Received generation command for user: {}, mode: {}", command.getUserId(), command.getMode());
        return commandHandler.handle(command);
    }
}

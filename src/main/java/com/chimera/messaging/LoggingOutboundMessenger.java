package com.chimera.messaging;

import lombok.extern.slf4j.Slf4j;

/**
 * Default messenger used when no transport is wired in.
 */
@Slf4j
public class LoggingOutboundMessenger implements OutboundMessenger {

    @Override
    public void sendMessage(String recipientName, OutboundMessage message) {
        log.info("-> {}: {}", recipientName, message);
    }
}

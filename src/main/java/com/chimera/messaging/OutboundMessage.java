package com.chimera.messaging;

/**
 * Reply routed to the transport actor.
 */
public interface OutboundMessage {

    String getUserId();

    Long getChatId();
}

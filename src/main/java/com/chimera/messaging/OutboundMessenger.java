package com.chimera.messaging;

/**
 * Delivery primitive of the surrounding actor system.
 */
public interface OutboundMessenger {

    /**
     * Route a message to the named actor. Must not block.
     *
     * @param recipientName actor name, e.g. "telegram"
     * @param message       reply to deliver
     */
    void sendMessage(String recipientName, OutboundMessage message);
}

package com.chimera.event;

import reactor.core.publisher.Mono;

/**
 * External ordered event log. Events sharing a stream id must be observed in append order.
 */
public interface EventSink {

    Mono<Void> append(ObservabilityEvent event);
}

package com.chimera.event;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Default sink used when no event store is wired in: one log line per event.
 */
@Slf4j
public class LoggingEventSink implements EventSink {

    @Override
    public Mono<Void> append(ObservabilityEvent event) {
        return Mono.fromRunnable(() -> log.info("event stream={} type={} data={}",
                event.getStreamId(), event.getEventType(), event.getData()));
    }
}

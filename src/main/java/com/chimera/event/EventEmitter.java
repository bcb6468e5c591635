package com.chimera.event;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Fire-and-forget publishing to the {@link EventSink}.
 * <p>
 * {@code emit} only enqueues. A single drain on the event scheduler appends events one at a
 * time in enqueue order. Sink failures, synchronous or not, are logged and dropped: telemetry
 * never affects the generation result.
 */
@Slf4j
@Component
public class EventEmitter {

    private static final Duration EMIT_CONTENTION_LIMIT = Duration.ofMillis(100);

    private final EventSink sink;
    private final Clock clock;
    private final Sinks.Many<ObservabilityEvent> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable drain;

    public EventEmitter(EventSink sink, Clock clock, @Qualifier("eventScheduler") Scheduler scheduler) {
        this.sink = sink;
        this.clock = clock;
        this.drain = queue.asFlux()
                .publishOn(scheduler)
                .concatMap(this::append)
                .subscribe(
                        ignored -> { },
                        error -> log.error("Event drain terminated: {}", error.toString()));
    }

    public void emit(String streamId, String eventType, Map<String, Object> data) {
        emit(ObservabilityEvent.create(streamId, eventType, data, clock.instant()));
    }

    public void emit(ObservabilityEvent event) {
        try {
            // concurrent emitters retry briefly instead of failing on non-serialized access
            queue.emitNext(event, Sinks.EmitFailureHandler.busyLooping(EMIT_CONTENTION_LIMIT));
        } catch (Sinks.EmissionException e) {
            log.warn("Dropped {} for stream {}: {}", event.getEventType(), event.getStreamId(), e.toString());
        }
    }

    private Mono<Void> append(ObservabilityEvent event) {
        return Mono.defer(() -> sink.append(event))
                .onErrorResume(error -> {
                    log.warn("Dropped {} for stream {}: {}",
                            event.getEventType(), event.getStreamId(), error.toString());
                    return Mono.empty();
                });
    }

    @PreDestroy
    public void close() {
        drain.dispose();
    }
}

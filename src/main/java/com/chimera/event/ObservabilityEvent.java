package com.chimera.event;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only telemetry event. Versioning per stream is assigned by the sink.
 */
@Value
@Builder
public class ObservabilityEvent {

    @NonNull
    @Builder.Default
    String eventId = UUID.randomUUID().toString();

    @NonNull
    String streamId;

    @NonNull
    String eventType;

    @NonNull
    Map<String, Object> data;

    @NonNull
    Instant timestamp;

    public static ObservabilityEvent create(String streamId, String eventType, Map<String, Object> data, Instant timestamp) {
        return ObservabilityEvent.builder()
                .streamId(streamId)
                .eventType(eventType)
                // values may be null (e.g. response_length when disabled)
                .data(Collections.unmodifiableMap(new LinkedHashMap<>(data)))
                .timestamp(timestamp)
                .build();
    }
}

package com.chimera.event;

/**
 * Event type names and stream id conventions.
 */
public final class EventTypes {

    public static final String GENERATION_PARAMETERS_USED = "GenerationParametersUsedEvent";
    public static final String JSON_MODE_FAILURE = "JSONModeFailureEvent";
    public static final String JSON_VALIDATION_FAILED = "JSONValidationFailedEvent";
    public static final String CACHE_HIT_METRIC = "CacheHitMetricEvent";

    public static final String METRICS_STREAM = "metrics";

    private EventTypes() {
    }

    public static String generationStream(String userId) {
        return "generation_" + userId;
    }

    public static String validationStream(String userId) {
        return "validation_" + userId;
    }

    public static String userStream(String userId) {
        return "user_" + userId;
    }
}

package com.chimera.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Parsed structured output. Always contains a non-null {@value #RESPONSE_FIELD} value.
 */
@ToString
@EqualsAndHashCode
public class StructuredPayload {

    public static final String RESPONSE_FIELD = "response";

    private final Map<String, Object> fields;
    private final String response;

    public StructuredPayload(Map<String, Object> fields, String response) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.response = response;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    /**
     * The user-facing text carried in the response field.
     */
    public String response() {
        return response;
    }
}

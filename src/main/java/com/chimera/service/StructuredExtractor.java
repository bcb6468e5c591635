package com.chimera.service;

import com.chimera.exception.ResponseFieldMissingException;
import com.chimera.exception.StructuredParseException;
import com.chimera.model.Mode;
import com.chimera.model.StructuredPayload;
import com.chimera.model.ValidationOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reads the provider's structured output.
 */
@Slf4j
@Component
public class StructuredExtractor {

    private static final TypeReference<Map<String, Object>> FIELDS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;
    private final SchemaValidator schemaValidator;

    public StructuredExtractor(ObjectMapper objectMapper, SchemaValidator schemaValidator) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.schemaValidator = schemaValidator;
    }

    /**
     * Parse the text as a JSON object carrying a {@code response} field.
     *
     * @throws ResponseFieldMissingException when the object has no usable response field
     * @throws StructuredParseException      when the text is not a JSON object
     */
    public StructuredPayload extract(String text) {
        JsonNode root;
        try {
            root = strictReader.readTree(text == null ? "" : text);
        } catch (JsonProcessingException e) {
            log.debug("Raw response: {}", abbreviate(text));
            throw new StructuredParseException("Malformed JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            log.debug("Raw response: {}", abbreviate(text));
            throw new StructuredParseException("Expected a JSON object but got "
                    + (root == null || root.isMissingNode() ? "nothing" : root.getNodeType()));
        }

        JsonNode responseNode = root.get(StructuredPayload.RESPONSE_FIELD);
        if (responseNode == null || responseNode.isNull()) {
            throw new ResponseFieldMissingException();
        }

        Map<String, Object> fields = objectMapper.convertValue(root, FIELDS_TYPE);
        StructuredPayload payload = new StructuredPayload(fields, responseText(responseNode));

        runDiagnosticCheck(payload);
        return payload;
    }

    private String responseText(JsonNode responseNode) {
        if (responseNode.isTextual()) {
            return responseNode.textValue();
        }
        return responseNode.toString();
    }

    /**
     * Early base-schema check kept for debugging. The outcome is discarded and never blocks.
     */
    private void runDiagnosticCheck(StructuredPayload payload) {
        try {
            ValidationOutcome outcome = schemaValidator.validate(payload, Mode.BASE);
            if (!outcome.isValid()) {
                log.trace("Diagnostic base check: {}", outcome.describeErrors());
            }
        } catch (RuntimeException e) {
            log.trace("Diagnostic base check failed", e);
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}

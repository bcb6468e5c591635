package com.chimera.service;

import com.chimera.config.ChimeraProperties;
import com.chimera.config.JacksonConfiguration;
import com.chimera.model.Mode;
import com.chimera.model.StructuredPayload;
import com.chimera.model.ValidationOutcome;
import com.chimera.model.schema.CreativeStructuredResponse;
import com.chimera.model.schema.ExpertStructuredResponse;
import com.chimera.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SchemaValidator.
 */
class SchemaValidatorTest {

    private static ValidatorFactory validatorFactory;

    private ChimeraProperties properties;
    private SchemaValidator schemaValidator;

    @BeforeAll
    static void createValidatorFactory() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidatorFactory() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = JacksonConfiguration.configure(new ObjectMapper());
        Validator validator = validatorFactory.getValidator();
        properties = TestProperties.create();
        schemaValidator = new SchemaValidator(objectMapper, validator, properties);
    }

    private static StructuredPayload payload(Map<String, Object> fields) {
        return new StructuredPayload(fields, String.valueOf(fields.get("response")));
    }

    @Test
    void testValidBasePayload() {
        ValidationOutcome outcome = schemaValidator.validate(
                payload(Map.of("response", "hi", "confidence", 0.7, "extra_field", true)), Mode.BASE);

        assertTrue(outcome.isValid());
        assertTrue(outcome.getErrors().isEmpty());
    }

    @Test
    void testOutOfRangeValueReportedAtJsonPath() {
        ValidationOutcome outcome = schemaValidator.validate(
                payload(Map.of("response", "hi", "engagement_level", 1.5)), Mode.TALK);

        assertFalse(outcome.isValid());
        assertEquals(1, outcome.getErrors().size());
        assertEquals("engagement_level", outcome.getErrors().get(0).getFieldPath());
    }

    @Test
    void testWrongTypeReportedAsBindingError() {
        ValidationOutcome outcome = schemaValidator.validate(
                payload(Map.of("response", "hi", "complexity_level", "very")), Mode.EXPERT);

        assertFalse(outcome.isValid());
        assertEquals("complexity_level", outcome.getErrors().get(0).getFieldPath());
        assertTrue(outcome.getErrors().get(0).getMessage().startsWith("invalid type"));
    }

    @Test
    void testBlankListElementReported() {
        ValidationOutcome outcome = schemaValidator.validate(
                payload(Map.of("response", "hi", "key_points", List.of("one", " "))), Mode.EXPERT);

        assertFalse(outcome.isValid());
        assertTrue(outcome.getErrors().get(0).getFieldPath().startsWith("key_points"));
    }

    @Test
    void testErrorsTruncatedWithCountSummary() {
        properties.getValidation().setMaxErrors(2);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("response", " ");
        fields.put("confidence", 2.0);
        fields.put("originality_score", -1.0);
        fields.put("imagery", List.of("1", "2", "3", "4", "5", "6", "7", "8", "9", "10", "11"));

        ValidationOutcome outcome = schemaValidator.validate(payload(fields), Mode.CREATIVE);

        assertFalse(outcome.isValid());
        assertEquals(3, outcome.getErrors().size());
        assertEquals("... and 2 more errors", outcome.getErrors().get(2).toString());
        // sorted by field path
        assertEquals("confidence", outcome.getErrors().get(0).getFieldPath());
        assertEquals("imagery", outcome.getErrors().get(1).getFieldPath());
    }

    @Test
    void testDisabledValidationAlwaysValid() {
        properties.getValidation().setEnabled(false);

        ValidationOutcome outcome = schemaValidator.validate(
                payload(Map.of("response", "hi", "confidence", 5)), Mode.BASE);

        assertTrue(outcome.isValid());
    }

    @Test
    void testSchemaSelectionIsTotal() {
        assertEquals(ExpertStructuredResponse.class, SchemaValidator.schemaFor(Mode.EXPERT));
        assertEquals(CreativeStructuredResponse.class, SchemaValidator.schemaFor(Mode.CREATIVE));
        for (Mode mode : Mode.values()) {
            assertNotNull(SchemaValidator.schemaFor(mode));
        }
    }
}

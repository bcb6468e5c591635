package com.chimera.service;

import com.chimera.config.ChimeraProperties;
import com.chimera.model.Mode;
import com.chimera.model.StructuredPayload;
import com.chimera.model.ValidationOutcome;
import com.chimera.model.schema.BaseStructuredResponse;
import com.chimera.model.schema.CreativeStructuredResponse;
import com.chimera.model.schema.ExpertStructuredResponse;
import com.chimera.model.schema.TalkStructuredResponse;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ElementKind;
import jakarta.validation.Path;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Advisory validation of structured payloads against the schema of their mode.
 * <p>
 * Binding is done with Jackson, so a wrongly typed field is reported at its JSON path; the
 * bound object is then checked with Bean Validation. Outcomes only feed telemetry and metrics.
 */
@Slf4j
@Component
public class SchemaValidator {

    private static final PropertyNamingStrategies.NamingBase SNAKE_CASE =
            new PropertyNamingStrategies.SnakeCaseStrategy();

    private static final Comparator<ValidationOutcome.FieldError> ERROR_ORDER =
            Comparator.comparing(ValidationOutcome.FieldError::getFieldPath)
                    .thenComparing(ValidationOutcome.FieldError::getMessage);

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final ChimeraProperties.ValidationConfig config;

    public SchemaValidator(ObjectMapper objectMapper, Validator validator, ChimeraProperties properties) {
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.config = properties.getValidation();
    }

    public ValidationOutcome validate(StructuredPayload payload, Mode mode) {
        if (!config.isEnabled()) {
            return ValidationOutcome.valid();
        }

        BaseStructuredResponse bound;
        try {
            bound = objectMapper.convertValue(payload.getFields(), schemaFor(mode));
        } catch (IllegalArgumentException e) {
            return ValidationOutcome.invalid(List.of(bindingError(e)), config.getMaxErrors());
        }

        List<ValidationOutcome.FieldError> errors = validator.validate(bound).stream()
                .map(SchemaValidator::toFieldError)
                .sorted(ERROR_ORDER)
                .toList();

        if (errors.isEmpty()) {
            return ValidationOutcome.valid();
        }
        log.debug("Payload failed {} schema with {} errors", mode, errors.size());
        return ValidationOutcome.invalid(errors, config.getMaxErrors());
    }

    static Class<? extends BaseStructuredResponse> schemaFor(Mode mode) {
        return switch (mode) {
            case TALK -> TalkStructuredResponse.class;
            case EXPERT -> ExpertStructuredResponse.class;
            case CREATIVE -> CreativeStructuredResponse.class;
            default -> BaseStructuredResponse.class;
        };
    }

    private static ValidationOutcome.FieldError toFieldError(ConstraintViolation<?> violation) {
        return new ValidationOutcome.FieldError(jsonPath(violation.getPropertyPath()), violation.getMessage());
    }

    private static String jsonPath(Path propertyPath) {
        StringBuilder path = new StringBuilder();
        for (Path.Node node : propertyPath) {
            if (node.getKind() == ElementKind.PROPERTY && node.getName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(SNAKE_CASE.translate(node.getName()));
            } else if (node.getKind() == ElementKind.CONTAINER_ELEMENT && node.getIndex() != null) {
                path.append('[').append(node.getIndex()).append(']');
            }
        }
        return path.toString();
    }

    private static ValidationOutcome.FieldError bindingError(IllegalArgumentException error) {
        if (error.getCause() instanceof JsonMappingException) {
            JsonMappingException mapping = (JsonMappingException) error.getCause();
            StringBuilder path = new StringBuilder();
            for (JsonMappingException.Reference reference : mapping.getPath()) {
                if (reference.getFieldName() != null) {
                    if (path.length() > 0) {
                        path.append('.');
                    }
                    path.append(reference.getFieldName());
                } else if (reference.getIndex() >= 0) {
                    path.append('[').append(reference.getIndex()).append(']');
                }
            }
            return new ValidationOutcome.FieldError(path.toString(), "invalid type: " + mapping.getOriginalMessage());
        }
        return new ValidationOutcome.FieldError("", String.valueOf(error.getMessage()));
    }
}

package com.chimera.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of advisory schema validation.
 */
@Value
public class ValidationOutcome {

    private static final ValidationOutcome VALID = new ValidationOutcome(true, List.of());

    boolean valid;
    List<FieldError> errors;

    public static ValidationOutcome valid() {
        return VALID;
    }

    /**
     * Build an invalid outcome keeping at most {@code maxErrors} errors. When truncated, a
     * count-only entry is appended.
     */
    public static ValidationOutcome invalid(List<FieldError> errors, int maxErrors) {
        int cap = Math.max(0, maxErrors);
        if (errors.size() <= cap) {
            return new ValidationOutcome(false, List.copyOf(errors));
        }
        List<FieldError> truncated = new ArrayList<>(errors.subList(0, cap));
        truncated.add(new FieldError("", "... and " + (errors.size() - cap) + " more errors"));
        return new ValidationOutcome(false, List.copyOf(truncated));
    }

    public List<String> describeErrors() {
        return errors.stream().map(FieldError::toString).toList();
    }

    @Value
    public static class FieldError {
        String fieldPath;
        String message;

        @Override
        public String toString() {
            return fieldPath.isEmpty() ? message : fieldPath + ": " + message;
        }
    }
}

package com.chimera.exception;

/**
 * The provider's output could not be read as a structured JSON object.
 */
public class StructuredParseException extends GenerationException {

    public StructuredParseException(String message) {
        super(message);
    }

    public StructuredParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

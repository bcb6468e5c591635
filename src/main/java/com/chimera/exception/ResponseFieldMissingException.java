package com.chimera.exception;

/**
 * Well-formed JSON object without a usable {@code response} field.
 */
public class ResponseFieldMissingException extends StructuredParseException {

    public ResponseFieldMissingException() {
        super("JSON doesn't contain 'response' field");
    }
}

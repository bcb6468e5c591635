package com.chimera.exception;

/**
 * Failure while talking to the completion provider: HTTP error status, transport error,
 * or an undecodable stream chunk.
 */
public class ProviderException extends GenerationException {

    private final Integer statusCode;

    public ProviderException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ProviderException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the provider, or null for transport and decoding failures.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}

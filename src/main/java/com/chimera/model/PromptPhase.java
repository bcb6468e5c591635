package com.chimera.model;

/**
 * Request variant.
 * STRUCTURED asks the provider for a JSON object and appends schema instructions;
 * FALLBACK is the plain-text request used after a structured parse failure.
 */
public enum PromptPhase {
    STRUCTURED,
    FALLBACK
}

package com.chimera.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for Chimera.
 */
@Data
@Component
@ConfigurationProperties(prefix = "chimera")
public class ChimeraProperties {

    private ProviderConfig provider = new ProviderConfig();
    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    private GenerationConfig generation = new GenerationConfig();
    private ValidationConfig validation = new ValidationConfig();
    private TelemetryConfig telemetry = new TelemetryConfig();

    /**
     * Generation parameters keyed by mode id. Missing modes or fields fall back to built-in defaults.
     */
    private Map<String, ModeParametersConfig> modes = new HashMap<>();

    /**
     * Prompt texts keyed by mode id. The "base" entry is the full system prompt,
     * other entries are modifiers appended to it.
     */
    private Map<String, PromptConfig> prompts = new HashMap<>();

    /**
     * JSON schema instruction blocks keyed by mode id, used in the structured phase only.
     */
    private Map<String, String> schemaInstructions = new HashMap<>();

    @Data
    public static class ProviderConfig {
        private String name = "deepseek";
        private String baseUrl = "https://api.deepseek.com";
        private String apiKey;
        private String model = "deepseek-chat";
        private Duration timeout = Duration.ofSeconds(60);
        private boolean includeUsage = true;
    }

    @Data
    public static class CircuitBreakerConfig {
        private int failureThreshold = 3;
        private Duration recoveryTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class GenerationConfig {
        private boolean jsonModeEnabled = true;
        private boolean jsonFallbackEnabled = true;
        private String replyTo = "telegram";
    }

    @Data
    public static class ValidationConfig {
        private boolean enabled = true;
        private boolean logFailures = true;
        private int maxErrors = 5;
    }

    @Data
    public static class TelemetryConfig {
        private boolean logParametersUsage = true;
        private boolean logResponseLength = true;
        private boolean debugModeSelection = false;
        private int cacheHitLogInterval = 10;
    }

    @Data
    public static class ModeParametersConfig {
        private Double temperature;
        private Double topP;
        private Integer maxTokens;
        private Double frequencyPenalty;
        private Double presencePenalty;
    }

    @Data
    public static class PromptConfig {
        private String structured;
        private String fallback;
    }
}

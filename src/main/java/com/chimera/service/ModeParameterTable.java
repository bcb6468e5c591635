package com.chimera.service;

import com.chimera.config.ChimeraProperties;
import com.chimera.model.Mode;
import com.chimera.model.ModeParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Generation parameters per mode.
 * <p>
 * Built once from configuration. Each configured value overrides the built-in default for its
 * mode, so every mode always has a complete entry.
 */
@Slf4j
@Component
public class ModeParameterTable {

    static final ModeParameters BASE_DEFAULTS = ModeParameters.builder()
            .temperature(0.82)
            .topP(0.85)
            .maxTokens(1800)
            .frequencyPenalty(0.4)
            .presencePenalty(0.65)
            .build();

    private final Map<Mode, ModeParameters> table;

    public ModeParameterTable(ChimeraProperties properties) {
        Map<Mode, ModeParameters> resolved = new EnumMap<>(Mode.class);
        for (Mode mode : Mode.values()) {
            ChimeraProperties.ModeParametersConfig configured = properties.getModes().get(mode.getId());
            resolved.put(mode, merge(defaultsFor(mode), configured));
        }
        properties.getModes().keySet().stream()
                .filter(id -> !Mode.isKnown(id))
                .forEach(id -> log.warn("Ignoring generation parameters for unknown mode '{}'", id));
        this.table = Collections.unmodifiableMap(resolved);
        log.info("Generation parameters: {}", table);
    }

    /**
     * Parameters for the mode. Total over {@link Mode}.
     */
    public ModeParameters resolve(Mode mode) {
        return table.getOrDefault(mode, table.get(Mode.BASE));
    }

    /**
     * Parameters for a raw mode id; unknown ids get the base entry.
     */
    public ModeParameters resolve(String modeId) {
        return resolve(Mode.resolve(modeId));
    }

    static ModeParameters defaultsFor(Mode mode) {
        return switch (mode) {
            case TALK -> BASE_DEFAULTS.toBuilder()
                    .temperature(0.9).topP(0.9).maxTokens(1500).frequencyPenalty(0.5).presencePenalty(0.7)
                    .build();
            case EXPERT -> BASE_DEFAULTS.toBuilder()
                    .temperature(0.6).topP(0.8).maxTokens(2500).frequencyPenalty(0.2).presencePenalty(0.3)
                    .build();
            case CREATIVE -> BASE_DEFAULTS.toBuilder()
                    .temperature(1.0).topP(0.95).maxTokens(2000).frequencyPenalty(0.6).presencePenalty(0.8)
                    .build();
            default -> BASE_DEFAULTS;
        };
    }

    private static ModeParameters merge(ModeParameters defaults, ChimeraProperties.ModeParametersConfig configured) {
        if (configured == null) {
            return defaults;
        }
        ModeParameters.ModeParametersBuilder builder = defaults.toBuilder();
        if (configured.getTemperature() != null) {
            builder.temperature(configured.getTemperature());
        }
        if (configured.getTopP() != null) {
            builder.topP(configured.getTopP());
        }
        if (configured.getMaxTokens() != null) {
            builder.maxTokens(configured.getMaxTokens());
        }
        if (configured.getFrequencyPenalty() != null) {
            builder.frequencyPenalty(configured.getFrequencyPenalty());
        }
        if (configured.getPresencePenalty() != null) {
            builder.presencePenalty(configured.getPresencePenalty());
        }
        return builder.build();
    }
}

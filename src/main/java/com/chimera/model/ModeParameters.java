package com.chimera.model;

import lombok.Builder;
import lombok.Value;

/**
 * Complete set of sampling parameters for one mode.
 */
@Value
@Builder(toBuilder = true)
public class ModeParameters {
    double temperature;
    double topP;
    int maxTokens;
    double frequencyPenalty;
    double presencePenalty;
}

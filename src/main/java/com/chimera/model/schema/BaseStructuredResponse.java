package com.chimera.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Schema shared by every mode. Unknown fields are tolerated.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BaseStructuredResponse {

    @NotBlank
    @JsonProperty("response")
    private String response;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @JsonProperty("confidence")
    private Double confidence;

    @Size(max = 100)
    @JsonProperty("emotional_tone")
    private String emotionalTone;
}

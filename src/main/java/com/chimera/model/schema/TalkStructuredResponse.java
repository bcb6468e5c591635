package com.chimera.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TalkStructuredResponse extends BaseStructuredResponse {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @JsonProperty("engagement_level")
    private Double engagementLevel;

    @Size(max = 5)
    @JsonProperty("suggested_topics")
    private List<@NotBlank String> suggestedTopics;
}

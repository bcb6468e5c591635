package com.chimera.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExpertStructuredResponse extends BaseStructuredResponse {

    @Size(max = 10)
    @JsonProperty("key_points")
    private List<@NotBlank String> keyPoints;

    @JsonProperty("references")
    private List<String> references;

    @Min(1)
    @Max(5)
    @JsonProperty("complexity_level")
    private Integer complexityLevel;
}

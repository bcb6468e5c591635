package com.chimera.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreativeStructuredResponse extends BaseStructuredResponse {

    @Size(max = 50)
    @JsonProperty("style")
    private String style;

    @Size(max = 10)
    @JsonProperty("imagery")
    private List<String> imagery;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @JsonProperty("originality_score")
    private Double originalityScore;
}

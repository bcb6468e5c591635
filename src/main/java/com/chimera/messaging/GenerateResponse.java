package com.chimera.messaging;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound command asking for a reply to a user message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerateResponse {

    @NotBlank
    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("chat_id")
    private Long chatId;

    @NotBlank
    @JsonProperty("text")
    private String text;

    @JsonProperty("include_prompt")
    private Boolean includePrompt; // defaults to true

    @JsonProperty("mode")
    private String mode; // defaults to "base"
}

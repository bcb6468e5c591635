package com.chimera.messaging;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Failure reply. {@code error} is shown to the user as is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorMessage implements OutboundMessage {

    public static final String GENERATION_ERROR = "generation_error";

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("chat_id")
    private Long chatId;

    @JsonProperty("error")
    private String error;

    @JsonProperty("error_type")
    private String errorType;
}

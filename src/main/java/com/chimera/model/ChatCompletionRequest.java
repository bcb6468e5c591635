package com.chimera.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OpenAI-compatible chat completion request model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionRequest {

    @JsonProperty("model")
    private String model;

    @JsonProperty("messages")
    private List<Message> messages;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("top_p")
    private Double topP;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("frequency_penalty")
    private Double frequencyPenalty;

    @JsonProperty("presence_penalty")
    private Double presencePenalty;

    @JsonProperty("stream")
    private Boolean stream;

    @JsonProperty("stream_options")
    private StreamOptions streamOptions;

    @JsonProperty("response_format")
    private ResponseFormat responseFormat;

    /**
     * Response format hint. Only {@code json_object} is used.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResponseFormat {

        @JsonProperty("type")
        private String type;

        public static ResponseFormat jsonObject() {
            return new ResponseFormat("json_object");
        }
    }

    /**
     * Asks the provider to append a usage chunk at the end of the stream.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StreamOptions {

        @JsonProperty("include_usage")
        private Boolean includeUsage;
    }
}

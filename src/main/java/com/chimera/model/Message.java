package com.chimera.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chat message model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";

    @JsonProperty("role")
    private String role; // system, user, assistant

    @JsonProperty("content")
    private String content;

    public static Message system(String content) {
        return new Message(ROLE_SYSTEM, content);
    }

    public static Message user(String content) {
        return new Message(ROLE_USER, content);
    }
}

package com.graphmem.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for a chat turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotBlank(message = "sessionId is required")
    @JsonAlias("session")
    private String sessionId;

    /**
     * Speaker of the message; user, assistant or an agent name.
     */
    @NotBlank(message = "role is required")
    @Builder.Default
    private String role = "user";

    @NotNull(message = "content is required")
    private String content;
}

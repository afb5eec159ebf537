package com.stressease.backend.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChatMessageRequest {

    @NotBlank(message = "Message cannot be empty")
    private String message;

    /**
     * Optional. Null or blank opens a new session.
     * An id the server no longer knows is rejected as expired.
     */
    private String sessionId;
}

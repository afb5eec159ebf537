package com.stressease.backend.chat;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Archived summary of a finished chat session. Written once, when the user
 * asks for the session to be summarized; the live session is then removed.
 *
 * Collection: chat_summaries
 */
@Document(collection = "chat_summaries")
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatSummary {

    @Id
    private String id;

    @Indexed
    private String userId;

    private String sessionId;

    private String title;

    private String summary;

    private int messageCount;

    @CreatedDate
    private Instant createdAt;
}

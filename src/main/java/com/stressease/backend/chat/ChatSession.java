package com.stressease.backend.chat;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Live conversational state for one chat session. Lives in the
 * {@link ChatSessionStore} until the session is ended or summarized.
 *
 * {@code version} increases on every committed turn and backs
 * {@link ChatSessionStore#compareAndDelete(String, long)}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession {

    private String sessionId;
    private String userId;
    private Dialogue dialogue;

    @Builder.Default
    private CrisisOfferState crisisOfferState = CrisisOfferState.NOT_OFFERED;

    private long version;
    private Instant createdAt;
    private Instant lastActiveAt;

    public boolean isOwnedBy(String candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }
}

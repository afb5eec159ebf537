package com.stressease.backend.chat;

import com.stressease.backend.exception.InputValidationException;
import com.stressease.backend.exception.StorageException;
import com.stressease.backend.exception.UpstreamGenerationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Archives a live session as a titled summary and ends it.
 *
 * The session is removed only after the summary has been stored, so a failed
 * generation or write leaves it intact for another attempt.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SessionSummaryService {

    private final ConversationService conversationService;
    private final ChatSessionStore sessionStore;
    private final SessionLocks sessionLocks;
    private final DialogueService dialogueService;
    private final ChatSummaryRepository summaryRepository;

    public ChatSummary summarize(String userId, String sessionId) {
        return sessionLocks.withLock(sessionId, () -> {
            ChatSession session = conversationService.findOwnedSession(userId, sessionId);
            Dialogue dialogue = session.getDialogue();

            int messageCount = dialogue.turns().size();
            if (messageCount == 0) {
                throw new InputValidationException("session_id", "Session has no messages to summarize");
            }

            String summary = dialogueService.summarize(dialogue)
                    .orElseThrow(() -> new UpstreamGenerationException(
                            "Could not generate a summary right now. Please try again."));
            String title = dialogueService.title(dialogue);

            ChatSummary saved;
            try {
                saved = summaryRepository.save(ChatSummary.builder()
                        .userId(userId)
                        .sessionId(sessionId)
                        .title(title)
                        .summary(summary)
                        .messageCount(messageCount)
                        .build());
            } catch (DataAccessException e) {
                throw new StorageException("Failed to store summary for session " + sessionId, e);
            }

            sessionStore.compareAndDelete(sessionId, session.getVersion());
            log.info("Session summarized and ended [sessionId={}, userId={}, summaryId={}, messages={}]",
                    sessionId, userId, saved.getId(), messageCount);
            return saved;
        });
    }

    public List<ChatSummary> listSummaries(String userId) {
        return summaryRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }
}

package com.stressease.backend.chat;

import com.stressease.backend.exception.InputValidationException;
import com.stressease.backend.exception.SessionExpiredException;
import com.stressease.backend.exception.StorageException;
import com.stressease.backend.exception.UpstreamGenerationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SessionSummaryServiceTest {

    private InMemoryChatSessionStore store;
    private DialogueService dialogueService;
    private ChatSummaryRepository repository;
    private SessionSummaryService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryChatSessionStore();
        dialogueService = mock(DialogueService.class);
        repository = mock(ChatSummaryRepository.class);
        SessionLocks locks = new SessionLocks(4, 1000);

        ConversationService conversationService = mock(ConversationService.class);
        when(conversationService.findOwnedSession(anyString(), anyString())).thenAnswer(inv -> {
            String userId = inv.getArgument(0);
            String sessionId = inv.getArgument(1);
            return store.get(sessionId).filter(s -> s.isOwnedBy(userId))
                    .orElseThrow(() -> new SessionExpiredException(sessionId));
        });

        service = new SessionSummaryService(conversationService, store, locks, dialogueService, repository);
    }

    @Test
    void summarize_storesSummaryAndEndsSession() {
        store.compareAndPut(session(Dialogue.open("persona").append("exams", "tell me more").append("so much", "I hear you")), 0);
        when(dialogueService.summarize(any())).thenReturn(Optional.of("The user talked about exams."));
        when(dialogueService.title(any())).thenReturn("Exam Stress");
        when(repository.save(any())).thenAnswer(inv -> {
            ChatSummary summary = inv.getArgument(0);
            summary.setId("sum-1");
            summary.setCreatedAt(Instant.now());
            return summary;
        });

        ChatSummary saved = service.summarize("user-1", "s-1");

        assertThat(saved.getId()).isEqualTo("sum-1");
        assertThat(saved.getTitle()).isEqualTo("Exam Stress");
        assertThat(saved.getSummary()).isEqualTo("The user talked about exams.");
        assertThat(saved.getMessageCount()).isEqualTo(4);
        assertThat(saved.getSessionId()).isEqualTo("s-1");
        assertThat(store.get("s-1")).isEmpty();
    }

    @Test
    void summarize_generationFails_keepsSession() {
        store.compareAndPut(session(Dialogue.open("persona").append("a", "b")), 0);
        when(dialogueService.summarize(any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.summarize("user-1", "s-1"))
                .isInstanceOf(UpstreamGenerationException.class);
        assertThat(store.get("s-1")).isPresent();
        verifyNoInteractions(repository);
    }

    @Test
    void summarize_storageFails_keepsSession() {
        store.compareAndPut(session(Dialogue.open("persona").append("a", "b")), 0);
        when(dialogueService.summarize(any())).thenReturn(Optional.of("summary"));
        when(dialogueService.title(any())).thenReturn("Title");
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> service.summarize("user-1", "s-1")).isInstanceOf(StorageException.class);
        assertThat(store.get("s-1")).isPresent();
    }

    @Test
    void summarize_emptyDialogue_rejected() {
        store.compareAndPut(session(Dialogue.open("persona")), 0);

        assertThatThrownBy(() -> service.summarize("user-1", "s-1"))
                .isInstanceOf(InputValidationException.class);
        verifyNoInteractions(dialogueService);
    }

    @Test
    void summarize_unknownSession_throwsExpired() {
        assertThatThrownBy(() -> service.summarize("user-1", "nope"))
                .isInstanceOf(SessionExpiredException.class);
    }

    private static ChatSession session(Dialogue dialogue) {
        return ChatSession.builder()
                .sessionId("s-1")
                .userId("user-1")
                .dialogue(dialogue)
                .version(2)
                .build();
    }
}
